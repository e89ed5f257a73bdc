package com.codeknowledge.mcp.backend.knowledge.persistence;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Row of {@code file_knowledge}. Rows are written only through {@link
 * FileKnowledgeUpsertRepository} so that change detection stays a single atomic statement; JPA
 * is used for reads.
 */
@Entity
@Table(name = "file_knowledge")
public class FileKnowledgeEntity {

  @Id
  private UUID id;

  @Column(name = "path", length = 500, nullable = false, unique = true)
  private String path;

  @Column(name = "repo", length = 100, nullable = false)
  private String repo;

  @Convert(converter = FileTypeConverter.class)
  @Column(name = "file_type", length = 50, nullable = false)
  private FileType fileType;

  @Convert(converter = TechnologyConverter.class)
  @Column(name = "technology", length = 50, nullable = false)
  private Technology technology;

  @Column(name = "summary", nullable = false, columnDefinition = "text")
  private String summary;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "key_elements", columnDefinition = "jsonb")
  private List<String> keyElements;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "dependencies", columnDefinition = "jsonb")
  private List<String> dependencies;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", columnDefinition = "jsonb")
  private List<String> tags;

  @Column(name = "content_hash", length = 128, nullable = false)
  private String contentHash;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private JsonNode metadata;

  @Column(name = "indexed_at", nullable = false)
  private Instant indexedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  public FileKnowledge toKnowledge() {
    return new FileKnowledge(
        path,
        repo,
        fileType,
        technology,
        summary,
        keyElements,
        dependencies,
        tags,
        contentHash,
        indexedAt,
        createdAt,
        metadata);
  }

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public String getRepo() {
    return repo;
  }

  public void setRepo(String repo) {
    this.repo = repo;
  }

  public FileType getFileType() {
    return fileType;
  }

  public void setFileType(FileType fileType) {
    this.fileType = fileType;
  }

  public Technology getTechnology() {
    return technology;
  }

  public void setTechnology(Technology technology) {
    this.technology = technology;
  }

  public String getSummary() {
    return summary;
  }

  public void setSummary(String summary) {
    this.summary = summary;
  }

  public List<String> getKeyElements() {
    return keyElements;
  }

  public void setKeyElements(List<String> keyElements) {
    this.keyElements = keyElements;
  }

  public List<String> getDependencies() {
    return dependencies;
  }

  public void setDependencies(List<String> dependencies) {
    this.dependencies = dependencies;
  }

  public List<String> getTags() {
    return tags;
  }

  public void setTags(List<String> tags) {
    this.tags = tags;
  }

  public String getContentHash() {
    return contentHash;
  }

  public void setContentHash(String contentHash) {
    this.contentHash = contentHash;
  }

  public JsonNode getMetadata() {
    return metadata;
  }

  public void setMetadata(JsonNode metadata) {
    this.metadata = metadata;
  }

  public Instant getIndexedAt() {
    return indexedAt;
  }

  public void setIndexedAt(Instant indexedAt) {
    this.indexedAt = indexedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }
}
