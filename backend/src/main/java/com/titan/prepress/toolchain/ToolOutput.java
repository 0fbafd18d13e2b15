package com.titan.prepress.toolchain;

import lombok.Value;

import java.nio.charset.StandardCharsets;

@Value
public class ToolOutput {
    int exitCode;
    byte[] stdout;
    String stderr;
    boolean truncated;

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    public static ToolOutput of(int exitCode, String stdout, String stderr) {
        return new ToolOutput(exitCode, stdout.getBytes(StandardCharsets.UTF_8), stderr, false);
    }
}
