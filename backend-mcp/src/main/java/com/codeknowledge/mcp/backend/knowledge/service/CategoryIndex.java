package com.codeknowledge.mcp.backend.knowledge.service;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Aggregated view of the record store grouped by repository, file type and technology. It holds no
 * state of its own: every instance is computed from a full scan.
 */
public record CategoryIndex(
    long totalCount,
    Map<String, Long> byRepo,
    Map<String, Long> byFileType,
    Map<String, Long> byTechnology,
    Instant mostRecentIndexedAt,
    long totalDependencies) {

  public static CategoryIndex of(Collection<FileKnowledge> records) {
    Objects.requireNonNull(records, "records");
    Map<String, Long> byRepo = new TreeMap<>();
    Map<String, Long> byFileType = new TreeMap<>();
    Map<String, Long> byTechnology = new TreeMap<>();
    Instant mostRecent = null;
    long dependencies = 0;
    for (FileKnowledge record : records) {
      byRepo.merge(record.repo(), 1L, Long::sum);
      if (record.fileType() != null) {
        byFileType.merge(record.fileType().value(), 1L, Long::sum);
      }
      if (record.technology() != null) {
        byTechnology.merge(record.technology().value(), 1L, Long::sum);
      }
      if (record.indexedAt() != null
          && (mostRecent == null || record.indexedAt().isAfter(mostRecent))) {
        mostRecent = record.indexedAt();
      }
      dependencies += record.dependencies().size();
    }
    return new CategoryIndex(
        records.size(),
        Collections.unmodifiableMap(byRepo),
        Collections.unmodifiableMap(byFileType),
        Collections.unmodifiableMap(byTechnology),
        mostRecent,
        dependencies);
  }
}
