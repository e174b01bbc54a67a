package com.sandy.aiot.vision.alerting.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class JsonMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(new TypeReference<>() { });
    }

    @Override
    protected Map<String, Object> emptyValue() {
        return new LinkedHashMap<>();
    }
}
