package com.titan.prepress.model;

import com.titan.prepress.report.IssueCounts;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSummary {
    private double score;
    private IssueCounts counts;
    private int pageCount;
}
