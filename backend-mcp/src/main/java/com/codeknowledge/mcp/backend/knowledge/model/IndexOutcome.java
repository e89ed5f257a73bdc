package com.codeknowledge.mcp.backend.knowledge.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IndexOutcome {
  CREATED,
  UNCHANGED,
  REPLACED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
