package com.csd.vulnscan.exception;

public class LockfileParseException extends ScanException {

    public LockfileParseException(String message) {
        super(message);
    }

    public LockfileParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
