package com.codeknowledge.mcp.backend.knowledge.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a stored knowledge record. Dependents are not part of it; they are derived
 * from the whole corpus on demand.
 */
public record FileKnowledge(
    String path,
    String repo,
    FileType fileType,
    Technology technology,
    String summary,
    List<String> keyElements,
    List<String> dependencies,
    List<String> tags,
    String contentHash,
    Instant indexedAt,
    Instant createdAt,
    JsonNode metadata) {

  public FileKnowledge {
    Objects.requireNonNull(path, "path");
    keyElements = keyElements != null ? List.copyOf(keyElements) : List.of();
    dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    tags = tags != null ? List.copyOf(tags) : List.of();
  }
}
