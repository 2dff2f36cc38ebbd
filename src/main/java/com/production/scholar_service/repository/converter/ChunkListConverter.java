package com.production.scholar_service.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.production.scholar_service.model.Chunk;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ChunkListConverter extends JsonAttributeConverter<List<Chunk>> {

    public ChunkListConverter() {
        super(new TypeReference<List<Chunk>>() {
        });
    }
}
