package com.titan.prepress.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * The analysis block of the report. {@code fontsEmbedded} is serialized as
 * {@code true}, {@code false} or {@code "unknown"} when fonts were not inspected.
 */
@Data
@JsonPropertyOrder({"pageCount", "pageSizes", "fontsEmbedded", "images", "colorSpace"})
public class PrepressAnalysis {

    static final String UNKNOWN = "unknown";
    static final String NOT_ANALYZED = "not_analyzed";

    private int pageCount;
    private List<PageSize> pageSizes = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Boolean fontsInspectionResult;

    public void recordFontsEmbedded(boolean embedded) {
        this.fontsInspectionResult = embedded;
    }

    @JsonProperty("fontsEmbedded")
    public Object getFontsEmbedded() {
        return fontsInspectionResult == null ? UNKNOWN : fontsInspectionResult;
    }

    // images and color spaces are not extracted yet
    @JsonProperty("images")
    public String getImages() {
        return NOT_ANALYZED;
    }

    @JsonProperty("colorSpace")
    public String getColorSpace() {
        return NOT_ANALYZED;
    }
}
