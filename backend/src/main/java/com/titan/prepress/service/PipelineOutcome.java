package com.titan.prepress.service;

import com.titan.prepress.model.OutputManifest;
import com.titan.prepress.model.ReportSummary;
import com.titan.prepress.report.PrepressReport;
import lombok.Value;

@Value
public class PipelineOutcome {
    PrepressReport report;
    OutputManifest manifest;

    public ReportSummary summary() {
        return ReportSummary.builder()
                .score(report.getSummary().getScore())
                .counts(report.getSummary().getCounts())
                .pageCount(report.getInput().getPageCount())
                .build();
    }
}
