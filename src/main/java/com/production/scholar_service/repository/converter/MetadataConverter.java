package com.production.scholar_service.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.production.scholar_service.model.Metadata;
import jakarta.persistence.Converter;

@Converter
public class MetadataConverter extends JsonAttributeConverter<Metadata> {

    public MetadataConverter() {
        super(new TypeReference<Metadata>() {
        });
    }
}
