package com.codeknowledge.mcp.backend.knowledge.service;

import com.codeknowledge.mcp.backend.config.KnowledgeBackendProperties;
import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledgeDraft;
import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import com.codeknowledge.mcp.backend.knowledge.model.IndexOutcome;
import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import com.codeknowledge.mcp.backend.knowledge.service.FileKnowledgeStore.ListFilter;
import com.codeknowledge.mcp.backend.knowledge.service.FileKnowledgeStore.UpsertResult;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeSearchEngine.SearchCriteria;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeSearchEngine.SearchHit;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point of the knowledge base: validates requests and composes the record store, the search
 * engine, the category index and the dependency graph. Not transactional itself, so each batch item
 * is written in its own store transaction.
 */
@Service
public class KnowledgeQueryService {

  private static final Logger log = LoggerFactory.getLogger(KnowledgeQueryService.class);

  private static final Comparator<RelatedFile> RELATED_ORDER =
      Comparator.comparingInt(RelatedFile::signals)
          .reversed()
          .thenComparing(
              related -> related.record().indexedAt(),
              Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(related -> related.record().path());

  private final FileKnowledgeStore store;
  private final FileKnowledgeValidator validator;
  private final KnowledgeSearchEngine searchEngine;
  private final KnowledgeBackendProperties properties;
  private final MeterRegistry meterRegistry;
  private final Map<String, Counter> outcomeCounters = new ConcurrentHashMap<>();

  public KnowledgeQueryService(
      FileKnowledgeStore store,
      FileKnowledgeValidator validator,
      KnowledgeSearchEngine searchEngine,
      KnowledgeBackendProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.store = Objects.requireNonNull(store, "store");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.searchEngine = Objects.requireNonNull(searchEngine, "searchEngine");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public IndexResult indexFile(IndexFileCommand command) {
    FileKnowledgeDraft draft = validator.validate(command);
    UpsertResult result = store.upsert(draft);
    count(result.outcome().value());
    return new IndexResult(result.outcome(), result.record());
  }

  /** Indexes every item independently; the result list always matches the input size and order. */
  public List<BatchItemResult> indexBatch(List<IndexFileCommand> commands) {
    if (commands == null || commands.isEmpty()) {
      return List.of();
    }
    int maxItems = properties.getBatch().getMaxItems();
    List<BatchItemResult> results = new ArrayList<>(commands.size());
    for (int index = 0; index < commands.size(); index++) {
      IndexFileCommand command = commands.get(index);
      String path = command != null ? command.path() : null;
      if (index >= maxItems) {
        results.add(
            BatchItemResult.failure(
                index,
                path,
                new BatchError(
                    "VALIDATION_ERROR", "Batch limit exceeded (" + maxItems + " items)")));
        continue;
      }
      try {
        IndexResult indexed = indexFile(command);
        results.add(BatchItemResult.success(index, indexed));
      } catch (KnowledgeBaseException ex) {
        count("failed");
        log.debug("Batch item {} ({}) rejected: {}", index, path, ex.getMessage());
        results.add(
            BatchItemResult.failure(index, path, new BatchError(ex.errorType(), ex.getMessage())));
      } catch (RuntimeException ex) {
        count("failed");
        log.warn("Batch item {} ({}) failed to store: {}", index, path, ex.getMessage());
        results.add(
            BatchItemResult.failure(
                index, path, new BatchError("STORAGE_ERROR", "Failed to store record")));
      }
    }
    long failed = results.stream().filter(result -> result.error() != null).count();
    log.info("Indexed batch of {} items, {} failed", results.size(), failed);
    return results;
  }

  public List<SearchHit> search(SearchCommand command) {
    if (command == null || KnowledgeSearchEngine.tokenize(command.query()).isEmpty()) {
      throw new InvalidQueryException("Search query must not be blank");
    }
    Set<String> repos = repoSet(command.repo(), command.repos());
    Set<FileType> fileTypes = new LinkedHashSet<>();
    for (String raw : withShorthand(command.fileType(), command.fileTypes())) {
      fileTypes.add(optionalFileType(raw));
    }
    Set<Technology> technologies = new LinkedHashSet<>();
    for (String raw : withShorthand(command.technology(), command.technologies())) {
      technologies.add(optionalTechnology(raw));
    }
    int limit = resolveLimit(command.limit(), properties.getSearch().getDefaultLimit());

    // Single-valued filters are pushed down to the query, multi-valued ones are applied in memory.
    ListFilter pushDown =
        new ListFilter(singleOrNull(repos), singleOrNull(fileTypes), singleOrNull(technologies));
    List<FileKnowledge> candidates = store.listAll(pushDown);
    List<SearchHit> hits =
        searchEngine.search(
            candidates,
            new SearchCriteria(
                command.query(), limit, repos, fileTypes, technologies, command.tags()));
    log.debug(
        "Search '{}' scanned {} records, returned {} hits",
        command.query(),
        candidates.size(),
        hits.size());
    return hits;
  }

  /** Paths are matched exactly; a blank or unknown path is reported as not found. */
  public FileContext getFileContext(String path) {
    FileKnowledge record = store.get(path);
    DependencyGraph graph = DependencyGraph.build(store.findAll());
    return new FileContext(record, graph.directDependents(path));
  }

  /**
   * Records sharing tags or a dependency edge with {@code path}. Each shared tag is one signal, and
   * so is each edge direction between the two records.
   */
  public List<RelatedFile> findRelated(String path, Integer limit) {
    if (!StringUtils.hasText(path)) {
      return List.of();
    }
    List<FileKnowledge> corpus = store.findAll();
    FileKnowledge source =
        corpus.stream().filter(record -> record.path().equals(path)).findFirst().orElse(null);
    if (source == null) {
      return List.of();
    }
    Set<String> sourceTags = lowerCaseSet(source.tags());
    Set<String> sourceDependencies = new LinkedHashSet<>(source.dependencies());

    List<RelatedFile> related = new ArrayList<>();
    for (FileKnowledge candidate : corpus) {
      if (candidate.path().equals(path)) {
        continue;
      }
      List<String> sharedTags =
          candidate.tags().stream()
              .map(tag -> tag.toLowerCase(Locale.ROOT))
              .distinct()
              .filter(sourceTags::contains)
              .toList();
      boolean sourceDependsOnCandidate = sourceDependencies.contains(candidate.path());
      boolean candidateDependsOnSource = candidate.dependencies().contains(path);
      int signals =
          sharedTags.size()
              + (sourceDependsOnCandidate ? 1 : 0)
              + (candidateDependsOnSource ? 1 : 0);
      if (signals > 0) {
        related.add(
            new RelatedFile(
                candidate,
                signals,
                sharedTags,
                sourceDependsOnCandidate,
                candidateDependsOnSource));
      }
    }
    related.sort(RELATED_ORDER);
    int resolved = resolveLimit(limit, properties.getRelated().getDefaultLimit());
    return related.size() > resolved ? List.copyOf(related.subList(0, resolved)) : related;
  }

  public List<FileKnowledge> searchByType(SearchByTypeCommand command) {
    if (command == null
        || (!StringUtils.hasText(command.fileType())
            && !StringUtils.hasText(command.technology()))) {
      throw new KnowledgeValidationException("fileType or technology is required");
    }
    FileType fileType = optionalFileType(command.fileType());
    Technology technology = optionalTechnology(command.technology());
    String repo = StringUtils.hasText(command.repo()) ? command.repo().trim() : null;
    int limit = resolveLimit(command.limit(), properties.getSearch().getDefaultLimit());
    return store.list(new ListFilter(repo, fileType, technology), limit);
  }

  public CategoryIndex getStats() {
    return CategoryIndex.of(store.findAll());
  }

  /** Never fails: a blank path yields an empty analysis, an unindexed one its known dependents. */
  public DependencyGraph.Analysis analyzeDependencies(String path, Integer maxDepth) {
    if (!StringUtils.hasText(path)) {
      return DependencyGraph.Analysis.empty(path);
    }
    KnowledgeBackendProperties.Graph graphProperties = properties.getGraph();
    int depth =
        maxDepth == null
            ? graphProperties.getDefaultMaxDepth()
            : Math.max(0, Math.min(maxDepth, graphProperties.getMaxDepthLimit()));
    DependencyGraph graph = DependencyGraph.build(store.findAll());
    DependencyGraph.Analysis analysis = graph.analyze(path, depth);
    if (!analysis.indexed()) {
      log.debug("Dependency analysis for unindexed path {}", path);
    }
    return analysis;
  }

  private int resolveLimit(Integer requested, int defaultLimit) {
    int max = properties.getSearch().getMaxLimit();
    if (requested == null) {
      return Math.min(defaultLimit, max);
    }
    return Math.max(1, Math.min(requested, max));
  }

  private FileType optionalFileType(String raw) {
    if (!StringUtils.hasText(raw)) {
      return null;
    }
    return FileType.find(raw)
        .orElseThrow(() -> new KnowledgeValidationException("Unknown fileType: " + raw));
  }

  private Technology optionalTechnology(String raw) {
    if (!StringUtils.hasText(raw)) {
      return null;
    }
    return Technology.find(raw)
        .orElseThrow(() -> new KnowledgeValidationException("Unknown technology: " + raw));
  }

  private static List<String> withShorthand(String single, List<String> values) {
    List<String> merged = new ArrayList<>();
    if (StringUtils.hasText(single)) {
      merged.add(single);
    }
    if (values != null) {
      values.stream().filter(StringUtils::hasText).forEach(merged::add);
    }
    return merged;
  }

  private static Set<String> repoSet(String single, List<String> values) {
    Set<String> repos = new LinkedHashSet<>();
    for (String repo : withShorthand(single, values)) {
      repos.add(repo.trim());
    }
    return repos;
  }

  private static <T> T singleOrNull(Set<T> values) {
    return values.size() == 1 ? values.iterator().next() : null;
  }

  private Set<String> lowerCaseSet(List<String> values) {
    Set<String> result = new LinkedHashSet<>();
    for (String value : values) {
      result.add(value.toLowerCase(Locale.ROOT));
    }
    return result;
  }

  private void count(String outcome) {
    outcomeCounters
        .computeIfAbsent(
            outcome,
            key ->
                Counter.builder("knowledge_index_outcome_total")
                    .tag("outcome", key)
                    .description("Knowledge index requests by outcome")
                    .register(meterRegistry))
        .increment();
  }

  public record IndexFileCommand(
      String path,
      String repo,
      String fileType,
      String technology,
      String summary,
      List<String> keyElements,
      List<String> dependencies,
      List<String> tags,
      String contentHash,
      JsonNode metadata) {}

  public record IndexResult(IndexOutcome outcome, FileKnowledge record) {}

  public record BatchError(String errorType, String message) {}

  public record BatchItemResult(
      int index, String path, IndexOutcome outcome, FileKnowledge record, BatchError error) {

    static BatchItemResult success(int index, IndexResult result) {
      return new BatchItemResult(
          index, result.record().path(), result.outcome(), result.record(), null);
    }

    static BatchItemResult failure(int index, String path, BatchError error) {
      return new BatchItemResult(index, path, null, null, error);
    }

    public boolean succeeded() {
      return error == null;
    }
  }

  /**
   * Search request. {@code repo}, {@code fileType} and {@code technology} are shorthand for a
   * one-element list; a record passes a dimension when its value is in the combined list.
   */
  public record SearchCommand(
      String query,
      Integer limit,
      String repo,
      String fileType,
      String technology,
      List<String> tags,
      List<String> repos,
      List<String> fileTypes,
      List<String> technologies) {

    public SearchCommand(
        String query,
        Integer limit,
        String repo,
        String fileType,
        String technology,
        List<String> tags) {
      this(query, limit, repo, fileType, technology, tags, null, null, null);
    }
  }

  public record SearchByTypeCommand(
      String fileType, String technology, String repo, Integer limit) {}

  public record FileContext(FileKnowledge record, List<String> dependents) {}

  public record RelatedFile(
      FileKnowledge record,
      int signals,
      List<String> sharedTags,
      boolean dependency,
      boolean dependent) {}
}
