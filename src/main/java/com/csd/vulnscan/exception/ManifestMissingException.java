package com.csd.vulnscan.exception;

public class ManifestMissingException extends ScanException {

    public ManifestMissingException(String message) {
        super(message);
    }
}
