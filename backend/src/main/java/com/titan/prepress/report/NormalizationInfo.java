package com.titan.prepress.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NormalizationInfo {
    private String originalFormat;
    /** "pdf" or null when no PDF could be produced. */
    private String normalizedFormat;
    private List<String> notes;
    private ImageMetadata metadata;
}
