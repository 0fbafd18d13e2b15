package com.titan.prepress.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FixType {
    RGB_TO_CMYK,
    NORMALIZE_DPI,
    FLATTEN_TRANSPARENCY,
    EMBED_FONTS,
    REMOVE_SPOT_COLOR,
    PDF_NORMALIZE,
    OTHER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
