package com.sandy.aiot.vision.alerting.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;

/**
 * Base for JSON text columns. Subclasses supply the target type and the value used for an empty column.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final TypeReference<T> type;

    protected JsonAttributeConverter(TypeReference<T> type) {
        this.type = type;
    }

    protected abstract T emptyValue();

    /** Length of the column text {@code value} would be stored as. */
    public static int storedLength(Object value) {
        if (value == null) return 0;
        try {
            return MAPPER.writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not representable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting " + type.getType() + " to JSON", e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return emptyValue();
        }
        try {
            return MAPPER.readValue(dbData, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting JSON to " + type.getType(), e);
        }
    }
}
