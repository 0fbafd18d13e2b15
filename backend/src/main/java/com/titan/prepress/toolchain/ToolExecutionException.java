package com.titan.prepress.toolchain;

/**
 * An external tool could not be launched, exited unsuccessfully, produced no usable output
 * or was killed by the watchdog.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
