package com.production.scholar_service.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.production.scholar_service.model.IngestionOptions;
import jakarta.persistence.Converter;

@Converter
public class IngestionOptionsConverter extends JsonAttributeConverter<IngestionOptions> {

    public IngestionOptionsConverter() {
        super(new TypeReference<IngestionOptions>() {
        });
    }
}
