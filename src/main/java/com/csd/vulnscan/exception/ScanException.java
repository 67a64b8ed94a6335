package com.csd.vulnscan.exception;

/**
 * Root of every error a scan can surface. A failed scan reports exactly one of these.
 */
public class ScanException extends RuntimeException {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
