package com.csd.vulnscan.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class PackageManagerInvocationException extends ScanException {

    private final List<String> command;
    private final int exitCode;  // -1 when the process never started or timed out

    public PackageManagerInvocationException(List<String> command, int exitCode, String message) {
        super(message);
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
    }

    public PackageManagerInvocationException(List<String> command, String message, Throwable cause) {
        super(message, cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
    }
}
