package com.titan.prepress.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum JobMode {
    CHECK,
    CHECK_AND_FIX;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Anything other than {@code check_and_fix} is treated as a plain check.
     */
    public static JobMode fromWireName(String value) {
        return "check_and_fix".equalsIgnoreCase(value) ? CHECK_AND_FIX : CHECK;
    }
}
