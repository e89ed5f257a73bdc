package com.codeknowledge.mcp.backend.knowledge.persistence;

import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link FileType} by its wire value so that SQL aggregates report {@code "bicep"}. */
@Converter
public class FileTypeConverter implements AttributeConverter<FileType, String> {

  @Override
  public String convertToDatabaseColumn(FileType attribute) {
    return attribute != null ? attribute.value() : null;
  }

  @Override
  public FileType convertToEntityAttribute(String dbData) {
    return dbData != null ? FileType.find(dbData).orElse(FileType.OTHER) : null;
  }
}
