package com.codeknowledge.mcp.backend.knowledge.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Technology category used to group knowledge records. */
public enum Technology {
  INFRASTRUCTURE("infrastructure-as-code"),
  BACKEND("backend"),
  FRONTEND("frontend"),
  DEVOPS("devops"),
  TESTING("testing"),
  DOCUMENTATION("documentation"),
  CONFIG("configuration"),
  UNCLASSIFIED("unclassified");

  private final String value;

  Technology(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static Optional<Technology> find(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String candidate = raw.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(
            technology ->
                technology.value.equals(candidate) || technology.name().equalsIgnoreCase(candidate))
        .findFirst();
  }
}
