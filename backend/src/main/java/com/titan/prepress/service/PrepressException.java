package com.titan.prepress.service;

import lombok.Getter;

/**
 * Domain failure carrying a machine-readable code that ends up in the job's error block.
 */
@Getter
public class PrepressException extends RuntimeException {

    public static final String PROCESSING_ERROR = "PROCESSING_ERROR";

    private final String code;

    public PrepressException(String code, String message) {
        super(message);
        this.code = code;
    }

    public PrepressException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static String codeOf(Throwable t) {
        return t instanceof PrepressException pe ? pe.getCode() : PROCESSING_ERROR;
    }
}
