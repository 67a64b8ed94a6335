package com.csd.vulnscan.exception;

import com.csd.vulnscan.model.AdvisorySource;
import lombok.Getter;

/**
 * A vulnerability source failed: non-success status after retries, oversized batch, or a malformed body.
 */
@Getter
public class AdvisorySourceException extends ScanException {

    private final AdvisorySource source;

    public AdvisorySourceException(AdvisorySource source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public AdvisorySourceException(AdvisorySource source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }
}
