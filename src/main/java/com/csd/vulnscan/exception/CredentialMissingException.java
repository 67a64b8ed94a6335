package com.csd.vulnscan.exception;

public class CredentialMissingException extends ScanException {

    public CredentialMissingException(String message) {
        super(message);
    }
}
