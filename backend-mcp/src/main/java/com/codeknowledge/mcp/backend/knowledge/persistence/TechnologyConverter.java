package com.codeknowledge.mcp.backend.knowledge.persistence;

import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class TechnologyConverter implements AttributeConverter<Technology, String> {

  @Override
  public String convertToDatabaseColumn(Technology attribute) {
    return attribute != null ? attribute.value() : null;
  }

  @Override
  public Technology convertToEntityAttribute(String dbData) {
    return dbData != null ? Technology.find(dbData).orElse(Technology.UNCLASSIFIED) : null;
  }
}
