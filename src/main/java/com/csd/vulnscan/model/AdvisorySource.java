package com.csd.vulnscan.model;

public enum AdvisorySource {
    OSV,    // batch vulnerability index (api.osv.dev)
    GHSA    // GitHub advisory graph
}
