package com.titan.prepress.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FindingType {
    MISSING_DPI,
    SPOT_COLOR_DETECTED,
    FONT_NOT_EMBEDDED,
    LOW_RESOLUTION_IMAGE,
    RGB_COLORSPACE,
    TRANSPARENCY_DETECTED,
    OTHER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
