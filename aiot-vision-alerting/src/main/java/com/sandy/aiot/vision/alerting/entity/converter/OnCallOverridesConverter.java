package com.sandy.aiot.vision.alerting.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sandy.aiot.vision.alerting.entity.OnCallOverride;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class OnCallOverridesConverter extends JsonAttributeConverter<List<OnCallOverride>> {

    public OnCallOverridesConverter() {
        super(new TypeReference<>() { });
    }

    @Override
    protected List<OnCallOverride> emptyValue() {
        return new ArrayList<>();
    }
}
