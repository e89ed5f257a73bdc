package com.codeknowledge.mcp.backend.knowledge.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Kind of source file a knowledge record describes. */
public enum FileType {
  BICEP("bicep"),
  TERRAFORM("terraform"),
  HELM("helm"),
  YAML("yaml"),
  CSHARP("csharp"),
  PYTHON("python"),
  JAVASCRIPT("javascript"),
  TYPESCRIPT("typescript"),
  JAVA("java"),
  POWERSHELL("powershell"),
  BASH("bash"),
  MARKDOWN("markdown"),
  DOCKERFILE("dockerfile"),
  ENV("env"),
  JSON("json"),
  OTHER("other");

  private final String value;

  FileType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Resolves either the wire value ({@code "bicep"}) or the constant name, ignoring case. */
  public static Optional<FileType> find(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String candidate = raw.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.value.equals(candidate) || type.name().equalsIgnoreCase(candidate))
        .findFirst();
  }
}
