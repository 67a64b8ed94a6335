package com.csd.vulnscan.process;

import lombok.Value;

@Value
public class CommandResult {
    int exitCode;
    String output;  // stdout and stderr, interleaved

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
