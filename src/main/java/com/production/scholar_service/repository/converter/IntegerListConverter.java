package com.production.scholar_service.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class IntegerListConverter extends JsonAttributeConverter<List<Integer>> {

    public IntegerListConverter() {
        super(new TypeReference<List<Integer>>() {
        });
    }
}
