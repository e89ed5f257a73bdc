package com.codeknowledge.mcp.backend.knowledge.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/** Validated and normalized payload of an index request, ready to be written. */
public record FileKnowledgeDraft(
    String path,
    String repo,
    FileType fileType,
    Technology technology,
    String summary,
    List<String> keyElements,
    List<String> dependencies,
    List<String> tags,
    String contentHash,
    JsonNode metadata) {

  public FileKnowledgeDraft {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(repo, "repo");
    Objects.requireNonNull(fileType, "fileType");
    Objects.requireNonNull(technology, "technology");
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(contentHash, "contentHash");
    keyElements = keyElements != null ? List.copyOf(keyElements) : List.of();
    dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    tags = tags != null ? List.copyOf(tags) : List.of();
  }
}
