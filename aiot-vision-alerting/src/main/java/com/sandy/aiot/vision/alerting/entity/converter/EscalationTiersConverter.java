package com.sandy.aiot.vision.alerting.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sandy.aiot.vision.alerting.entity.EscalationTier;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class EscalationTiersConverter extends JsonAttributeConverter<List<EscalationTier>> {

    public EscalationTiersConverter() {
        super(new TypeReference<>() { });
    }

    @Override
    protected List<EscalationTier> emptyValue() {
        return new ArrayList<>();
    }
}
