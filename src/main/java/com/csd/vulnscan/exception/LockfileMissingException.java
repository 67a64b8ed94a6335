package com.csd.vulnscan.exception;

/**
 * The chosen input cannot be scanned without a lockfile next to it.
 */
public class LockfileMissingException extends ScanException {

    public LockfileMissingException(String message) {
        super(message);
    }
}
