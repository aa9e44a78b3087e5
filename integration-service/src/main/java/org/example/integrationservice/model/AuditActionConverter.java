package org.example.integrationservice.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AuditActionConverter implements AttributeConverter<AuditAction, String> {

    @Override
    public String convertToDatabaseColumn(AuditAction action) {
        return action == null ? null : action.getValue();
    }

    @Override
    public AuditAction convertToEntityAttribute(String value) {
        return value == null ? null : AuditAction.fromValue(value);
    }
}
