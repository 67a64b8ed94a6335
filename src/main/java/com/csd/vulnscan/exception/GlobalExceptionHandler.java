package com.csd.vulnscan.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Turns scan failures into {@code {error, message}} bodies with a status that says whose fault it was.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({DetectionFailureException.class, ManifestMissingException.class,
            LockfileMissingException.class, LockfileParseException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadInput(RuntimeException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(PackageManagerInvocationException.class)
    public ResponseEntity<Map<String, String>> handlePackageManager(PackageManagerInvocationException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(CredentialMissingException.class)
    public ResponseEntity<Map<String, String>> handleCredential(CredentialMissingException ex) {
        return respond(HttpStatus.UNAUTHORIZED, ex);
    }

    @ExceptionHandler(AdvisorySourceException.class)
    public ResponseEntity<Map<String, String>> handleAdvisorySource(AdvisorySourceException ex) {
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(ScanException.class)
    public ResponseEntity<Map<String, String>> handleScan(ScanException ex) {
        log.error("Scan failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private static ResponseEntity<Map<String, String>> respond(HttpStatus status, RuntimeException ex) {
        if (status.is4xxClientError()) {
            log.warn("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        } else if (status != HttpStatus.INTERNAL_SERVER_ERROR) {
            log.error("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        }
        String message = ex.getMessage() == null ? "" : ex.getMessage();
        return ResponseEntity.status(status).body(Map.of(
                "error", ex.getClass().getSimpleName(),
                "message", message));
    }
}
