package com.codeknowledge.mcp.backend.knowledge.service;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledgeDraft;
import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import com.codeknowledge.mcp.backend.knowledge.model.IndexOutcome;
import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import com.codeknowledge.mcp.backend.knowledge.persistence.FileKnowledgeEntity;
import com.codeknowledge.mcp.backend.knowledge.persistence.FileKnowledgeRepository;
import com.codeknowledge.mcp.backend.knowledge.persistence.FileKnowledgeUpsertRepository;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Canonical per-file record store. Every public method runs in its own transaction, so callers
 * that loop over items (batch indexing) get per-item isolation.
 */
@Service
@Transactional(readOnly = true)
public class FileKnowledgeStore {

  private static final Logger log = LoggerFactory.getLogger(FileKnowledgeStore.class);

  static final Sort RECENT_FIRST =
      Sort.by(Sort.Order.desc("indexedAt"), Sort.Order.asc("path"));

  private final FileKnowledgeRepository repository;
  private final FileKnowledgeUpsertRepository upsertRepository;

  public FileKnowledgeStore(
      FileKnowledgeRepository repository, FileKnowledgeUpsertRepository upsertRepository) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.upsertRepository = Objects.requireNonNull(upsertRepository, "upsertRepository");
  }

  @Transactional
  public UpsertResult upsert(FileKnowledgeDraft draft) {
    Objects.requireNonNull(draft, "draft");
    // Postgres keeps microseconds; truncating keeps the returned snapshot equal to the stored one.
    Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
    IndexOutcome outcome = upsertRepository.upsert(draft, now);
    FileKnowledge stored =
        repository
            .findByPath(draft.path())
            .map(FileKnowledgeEntity::toKnowledge)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Record disappeared right after upsert: " + draft.path()));
    if (outcome == IndexOutcome.UNCHANGED) {
      log.debug("Skipped re-index of {}: content hash unchanged", draft.path());
    } else {
      log.info("Indexed {} ({}) repo={}", draft.path(), outcome.value(), draft.repo());
    }
    return new UpsertResult(outcome, stored);
  }

  public Optional<FileKnowledge> find(String path) {
    if (path == null) {
      return Optional.empty();
    }
    return repository.findByPath(path).map(FileKnowledgeEntity::toKnowledge);
  }

  public FileKnowledge get(String path) {
    return find(path).orElseThrow(() -> new KnowledgeNotFoundException(path));
  }

  /** Returns the records found for {@code paths} in request order; unknown paths are omitted. */
  public Map<String, FileKnowledge> getMany(Collection<String> paths) {
    if (paths == null || paths.isEmpty()) {
      return Map.of();
    }
    Set<String> requested =
        paths.stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    if (requested.isEmpty()) {
      return Map.of();
    }
    Map<String, FileKnowledge> found =
        repository.findByPathIn(requested).stream()
            .map(FileKnowledgeEntity::toKnowledge)
            .collect(Collectors.toMap(FileKnowledge::path, Function.identity()));
    Map<String, FileKnowledge> ordered = new LinkedHashMap<>();
    for (String path : requested) {
      FileKnowledge record = found.get(path);
      if (record != null) {
        ordered.put(path, record);
      }
    }
    return ordered;
  }

  /** Filtered listing, most recently indexed first. */
  public List<FileKnowledge> list(ListFilter filter, int limit) {
    ListFilter safeFilter = filter != null ? filter : ListFilter.none();
    return repository
        .findFilteredPage(
            safeFilter.repo(),
            safeFilter.fileType(),
            safeFilter.technology(),
            PageRequest.of(0, Math.max(1, limit), RECENT_FIRST))
        .stream()
        .map(FileKnowledgeEntity::toKnowledge)
        .toList();
  }

  /** Unbounded filtered scan, most recently indexed first. */
  public List<FileKnowledge> listAll(ListFilter filter) {
    ListFilter safeFilter = filter != null ? filter : ListFilter.none();
    return repository
        .findFiltered(
            safeFilter.repo(), safeFilter.fileType(), safeFilter.technology(), RECENT_FIRST)
        .stream()
        .map(FileKnowledgeEntity::toKnowledge)
        .toList();
  }

  public List<FileKnowledge> findAll() {
    return listAll(ListFilter.none());
  }

  public record ListFilter(String repo, FileType fileType, Technology technology) {

    public static ListFilter none() {
      return new ListFilter(null, null, null);
    }
  }

  public record UpsertResult(IndexOutcome outcome, FileKnowledge record) {}
}
