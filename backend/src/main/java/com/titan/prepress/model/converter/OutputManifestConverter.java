package com.titan.prepress.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.titan.prepress.model.OutputManifest;
import jakarta.persistence.Converter;

@Converter
public class OutputManifestConverter extends JsonAttributeConverter<OutputManifest> {
    public OutputManifestConverter() {
        super(new TypeReference<OutputManifest>() {});
    }
}
