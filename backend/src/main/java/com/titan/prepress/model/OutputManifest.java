package com.titan.prepress.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which downloadable outputs exist for a finished job.
 * {@code fixedPdf} is only set for check_and_fix jobs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutputManifest {

    @JsonProperty("report_json")
    private boolean reportJson;

    @JsonProperty("proof_png")
    private boolean proofPng;

    @JsonProperty("fixed_pdf")
    private Boolean fixedPdf;
}
