package com.codeknowledge.mcp.backend.knowledge.persistence;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledgeDraft;
import com.codeknowledge.mcp.backend.knowledge.model.IndexOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Writes {@code file_knowledge} rows with a single {@code INSERT ... ON CONFLICT} statement. The
 * conflict branch only fires when the stored content hash differs, so read-compare-write is atomic
 * per row and a matching hash leaves {@code indexed_at} untouched.
 */
@Repository
public class FileKnowledgeUpsertRepository {

  private static final String UPSERT_SQL =
      """
      INSERT INTO file_knowledge (
          id, path, repo, file_type, technology, summary, key_elements, dependencies, tags,
          content_hash, metadata, indexed_at, created_at)
      VALUES (?, ?, ?, ?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb), CAST(? AS jsonb), ?,
          CAST(? AS jsonb), ?, ?)
      ON CONFLICT (path) DO UPDATE SET
          repo = EXCLUDED.repo,
          file_type = EXCLUDED.file_type,
          technology = EXCLUDED.technology,
          summary = EXCLUDED.summary,
          key_elements = EXCLUDED.key_elements,
          dependencies = EXCLUDED.dependencies,
          tags = EXCLUDED.tags,
          content_hash = EXCLUDED.content_hash,
          metadata = EXCLUDED.metadata,
          indexed_at = EXCLUDED.indexed_at
      WHERE file_knowledge.content_hash IS DISTINCT FROM EXCLUDED.content_hash
      RETURNING (xmax = 0) AS inserted
      """;

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public FileKnowledgeUpsertRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public IndexOutcome upsert(FileKnowledgeDraft draft, Instant indexedAt) {
    Timestamp timestamp = Timestamp.from(indexedAt);
    List<Boolean> inserted =
        jdbcTemplate.query(
            UPSERT_SQL,
            (rs, rowNum) -> rs.getBoolean("inserted"),
            UUID.randomUUID(),
            draft.path(),
            draft.repo(),
            draft.fileType().value(),
            draft.technology().value(),
            draft.summary(),
            toJson(draft.keyElements()),
            toJson(draft.dependencies()),
            toJson(draft.tags()),
            draft.contentHash(),
            draft.metadata() != null ? toJson(draft.metadata()) : "{}",
            timestamp,
            timestamp);
    if (inserted.isEmpty()) {
      return IndexOutcome.UNCHANGED;
    }
    return Boolean.TRUE.equals(inserted.get(0)) ? IndexOutcome.CREATED : IndexOutcome.REPLACED;
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize knowledge column", ex);
    }
  }
}
