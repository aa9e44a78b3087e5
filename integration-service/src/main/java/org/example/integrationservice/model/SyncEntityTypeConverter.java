package org.example.integrationservice.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SyncEntityTypeConverter implements AttributeConverter<SyncEntityType, String> {

    @Override
    public String convertToDatabaseColumn(SyncEntityType type) {
        return type == null ? null : type.getValue();
    }

    @Override
    public SyncEntityType convertToEntityAttribute(String value) {
        return value == null ? null : SyncEntityType.fromValue(value);
    }
}
