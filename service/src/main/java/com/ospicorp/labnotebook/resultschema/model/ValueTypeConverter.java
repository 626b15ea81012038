package com.ospicorp.labnotebook.resultschema.model;

import com.ospicorp.labnotebook.validation.ValueType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ValueTypeConverter implements AttributeConverter<ValueType, String> {

  @Override
  public String convertToDatabaseColumn(ValueType attribute) {
    return attribute == null ? null : attribute.code();
  }

  @Override
  public ValueType convertToEntityAttribute(String dbData) {
    return dbData == null ? null : ValueType.fromCode(dbData);
  }
}
