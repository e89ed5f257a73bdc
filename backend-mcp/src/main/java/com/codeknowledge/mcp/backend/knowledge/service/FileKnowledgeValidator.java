package com.codeknowledge.mcp.backend.knowledge.service;

import com.codeknowledge.mcp.backend.config.KnowledgeBackendProperties;
import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledgeDraft;
import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.IndexFileCommand;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks required fields and limits of an index request and normalizes it. Paths are opaque and
 * kept exactly as given; every other text field is trimmed.
 */
@Component
public class FileKnowledgeValidator {

  private final KnowledgeBackendProperties.Validation limits;
  private final ObjectMapper objectMapper;

  public FileKnowledgeValidator(KnowledgeBackendProperties properties, ObjectMapper objectMapper) {
    this.limits = Objects.requireNonNull(properties, "properties").getValidation();
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public FileKnowledgeDraft validate(IndexFileCommand command) {
    if (command == null) {
      throw new KnowledgeValidationException("Index request must not be null");
    }
    String path = requiredValue(command.path(), "path");
    if (path.length() > limits.getMaxPathLength()) {
      throw new KnowledgeValidationException(
          "path length exceeds allowed limit (" + limits.getMaxPathLength() + ")");
    }
    String repo = required(command.repo(), "repo", limits.getMaxRepoLength());
    FileType fileType =
        FileType.find(requiredValue(command.fileType(), "fileType"))
            .orElseThrow(
                () -> new KnowledgeValidationException("Unknown fileType: " + command.fileType()));
    Technology technology =
        Technology.find(requiredValue(command.technology(), "technology"))
            .orElseThrow(
                () ->
                    new KnowledgeValidationException(
                        "Unknown technology: " + command.technology()));
    String summary = required(command.summary(), "summary", limits.getMaxSummaryLength());
    String contentHash =
        required(command.contentHash(), "contentHash", limits.getMaxContentHashLength());

    List<String> keyElements =
        cleanList(command.keyElements(), "keyElements", limits.getMaxKeyElements());
    List<String> dependencies =
        cleanList(command.dependencies(), "dependencies", limits.getMaxDependencies());
    List<String> tags = normalizeTags(command.tags());

    return new FileKnowledgeDraft(
        path,
        repo,
        fileType,
        technology,
        summary,
        keyElements,
        dependencies,
        tags,
        contentHash,
        normalizeMetadata(command.metadata()));
  }

  private String requiredValue(String value, String field) {
    if (!StringUtils.hasText(value)) {
      throw new KnowledgeValidationException(field + " is required");
    }
    return value;
  }

  private String required(String value, String field, int maxLength) {
    String trimmed = requiredValue(value, field).trim();
    if (trimmed.length() > maxLength) {
      throw new KnowledgeValidationException(
          field + " length exceeds allowed limit (" + maxLength + ")");
    }
    return trimmed;
  }

  private List<String> cleanList(List<String> values, String field, int maxSize) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    List<String> cleaned = new ArrayList<>(values.size());
    for (String value : values) {
      if (StringUtils.hasText(value)) {
        cleaned.add(value.trim());
      }
    }
    if (cleaned.size() > maxSize) {
      throw new KnowledgeValidationException(field + " limit exceeded (" + maxSize + ")");
    }
    return cleaned;
  }

  private List<String> normalizeTags(List<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return List.of();
    }
    Set<String> unique =
        tags.stream()
            .filter(StringUtils::hasText)
            .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    if (unique.size() > limits.getMaxTags()) {
      throw new KnowledgeValidationException("Tags limit exceeded (" + limits.getMaxTags() + ")");
    }
    return new ArrayList<>(unique);
  }

  private JsonNode normalizeMetadata(JsonNode metadata) {
    if (metadata == null || metadata.isNull() || metadata.isMissingNode()) {
      return objectMapper.createObjectNode();
    }
    if (!metadata.isObject()) {
      throw new KnowledgeValidationException("metadata must be a JSON object");
    }
    return metadata;
  }
}
