package com.sandy.aiot.vision.alerting.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sandy.aiot.vision.alerting.entity.Severity;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class SeverityListConverter extends JsonAttributeConverter<List<Severity>> {

    public SeverityListConverter() {
        super(new TypeReference<>() { });
    }

    @Override
    protected List<Severity> emptyValue() {
        return new ArrayList<>();
    }
}
