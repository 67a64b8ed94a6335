package com.csd.vulnscan.client;

import lombok.Getter;

/**
 * Non-2xx response from a remote API. Whether it is worth retrying depends on the status.
 */
@Getter
public class HttpStatusException extends RuntimeException {

    private final int status;

    public HttpStatusException(int status, String message) {
        super("HTTP " + status + ": " + message);
        this.status = status;
    }
}
