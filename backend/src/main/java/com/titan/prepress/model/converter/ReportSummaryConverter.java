package com.titan.prepress.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.titan.prepress.model.ReportSummary;
import jakarta.persistence.Converter;

@Converter
public class ReportSummaryConverter extends JsonAttributeConverter<ReportSummary> {
    public ReportSummaryConverter() {
        super(new TypeReference<ReportSummary>() {});
    }
}
