package org.example.modelgen.entity;

import jakarta.persistence.*;

@Converter
public class ModelGenerationStatusConverter implements AttributeConverter<ModelGenerationStatus, String> {

    @Override
    public String convertToDatabaseColumn(ModelGenerationStatus status) {
        return status == null ? ModelGenerationStatus.NONE.value() : status.value();
    }

    @Override
    public ModelGenerationStatus convertToEntityAttribute(String value) {
        return ModelGenerationStatus.fromValue(value);
    }
}
