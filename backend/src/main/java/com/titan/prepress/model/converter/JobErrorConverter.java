package com.titan.prepress.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.titan.prepress.model.JobError;
import jakarta.persistence.Converter;

@Converter
public class JobErrorConverter extends JsonAttributeConverter<JobError> {
    public JobErrorConverter() {
        super(new TypeReference<JobError>() {});
    }
}
