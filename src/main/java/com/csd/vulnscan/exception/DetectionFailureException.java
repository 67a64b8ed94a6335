package com.csd.vulnscan.exception;

public class DetectionFailureException extends ScanException {

    public DetectionFailureException(String message) {
        super(message);
    }
}
