package com.titan.prepress.toolchain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FileFormat {
    PDF("pdf"),
    JPG("jpg"),
    PNG("png"),
    TIFF("tif"),
    AI("ai"),
    PSD("psd"),
    UNKNOWN("unknown");

    private final String wireName;

    FileFormat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
