package com.codeknowledge.mcp.backend.knowledge.tool;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import com.codeknowledge.mcp.backend.knowledge.service.CategoryIndex;
import com.codeknowledge.mcp.backend.knowledge.service.DependencyGraph;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.BatchItemResult;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.FileContext;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.IndexFileCommand;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.IndexResult;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.RelatedFile;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.SearchByTypeCommand;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.SearchCommand;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeSearchEngine.SearchHit;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

@Component
public class KnowledgeTools {

  private final KnowledgeQueryService queryService;
  private final ObjectMapper objectMapper;

  public KnowledgeTools(KnowledgeQueryService queryService, ObjectMapper objectMapper) {
    this.queryService = queryService;
    this.objectMapper = objectMapper;
  }

  @Tool(
      name = "knowledge.index_file",
      description =
          "Stores the extracted knowledge of one source file. Required fields: `path`, `repo`, "
              + "`fileType`, `technology`, `summary`, `contentHash`. Re-indexing with the same "
              + "`contentHash` is a no-op (outcome `unchanged`); a different hash replaces the "
              + "record.")
  public IndexFileResponse indexFile(IndexFileInput input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    IndexResult result = queryService.indexFile(toCommand(input));
    return new IndexFileResponse(result.outcome().value(), result.record());
  }

  @Tool(
      name = "knowledge.index_batch",
      description =
          "Indexes several files at once. Each item is processed independently and the "
              + "response contains one result per input item, in input order, with either an "
              + "`outcome` or an `error`. Retry only the failed items.")
  public IndexBatchResponse indexBatch(IndexBatchInput input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    List<IndexFileInput> files = input.files() != null ? input.files() : List.of();
    List<BatchItemResult> results =
        queryService.indexBatch(
            files.stream().map(file -> file != null ? toCommand(file) : null).toList());
    long failed = results.stream().filter(result -> !result.succeeded()).count();
    return new IndexBatchResponse(results, results.size() - (int) failed, (int) failed);
  }

  @Tool(
      name = "knowledge.search",
      description =
          "Keyword search over indexed files. Each query term scores +3 for an exact tag, +2 for a "
              + "summary match, +1 for a key element match and +1 for a path match. Optional "
              + "filters: `repos`, `fileTypes`, `technologies` (a record matches when its value "
              + "is in the list; `repo`, `fileType`, `technology` are single-value shorthands) and "
              + "`tags`. `limit` defaults to 50.")
  public SearchResponse search(SearchInput input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    List<SearchHit> hits =
        queryService.search(
            new SearchCommand(
                input.query(),
                input.limit(),
                input.repo(),
                input.fileType(),
                input.technology(),
                input.tags(),
                input.repos(),
                input.fileTypes(),
                input.technologies()));
    return new SearchResponse(
        hits.stream()
            .map(
                hit ->
                    new SearchMatchView(
                        hit.record(), hit.score(), hit.matchedTerms(), hit.matchedElements()))
            .toList());
  }

  @Tool(
      name = "knowledge.get_file_context",
      description =
          "Returns the full stored knowledge of a file together with the files that depend on it. "
              + "Fails with NOT_FOUND when the path is not indexed.")
  public FileContext getFileContext(PathInput input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    return queryService.getFileContext(input.path());
  }

  @Tool(
      name = "knowledge.find_related",
      description =
          "Finds files that share tags or a dependency edge with `path`, ranked by the number of "
              + "shared signals. Returns an empty list when nothing is related.")
  public RelatedResponse findRelated(FindRelatedInput input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    return new RelatedResponse(queryService.findRelated(input.path(), input.limit()));
  }

  @Tool(
      name = "knowledge.search_by_type",
      description =
          "Lists indexed files of a given `fileType` and/or `technology`, optionally within "
              + "`repo`, most recently indexed first.")
  public FilesResponse searchByType(SearchByTypeInput input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    return new FilesResponse(
        queryService.searchByType(
            new SearchByTypeCommand(
                input.fileType(), input.technology(), input.repo(), input.limit())));
  }

  @Tool(
      name = "knowledge.get_stats",
      description =
          "Returns counts of indexed files by repository, file type and technology, the total "
              + "count and the most recent indexing time.")
  public CategoryIndex getStats() {
    return queryService.getStats();
  }

  @Tool(
      name = "knowledge.analyze_dependencies",
      description =
          "Returns the direct dependencies and dependents of `path` and the shortest dependency "
              + "depth of every file reachable from it (up to `maxDepth`, default 10). Works for "
              + "paths that are only referenced and never indexed.")
  public DependencyGraph.Analysis analyzeDependencies(AnalyzeDependenciesInput input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
    return queryService.analyzeDependencies(input.path(), input.maxDepth());
  }

  private IndexFileCommand toCommand(IndexFileInput input) {
    JsonNode metadata =
        input.metadata() != null ? objectMapper.valueToTree(input.metadata()) : null;
    return new IndexFileCommand(
        input.path(),
        input.repo(),
        input.fileType(),
        input.technology(),
        input.summary(),
        input.keyElements(),
        input.dependencies(),
        input.tags(),
        input.contentHash(),
        metadata);
  }

  public record IndexFileInput(
      String path,
      String repo,
      String fileType,
      String technology,
      String summary,
      List<String> keyElements,
      List<String> dependencies,
      List<String> tags,
      String contentHash,
      Map<String, Object> metadata) {}

  public record IndexFileResponse(String outcome, FileKnowledge record) {}

  public record IndexBatchInput(List<IndexFileInput> files) {}

  public record IndexBatchResponse(List<BatchItemResult> results, int succeeded, int failed) {}

  public record SearchInput(
      String query,
      Integer limit,
      String repo,
      String fileType,
      String technology,
      List<String> tags,
      List<String> repos,
      List<String> fileTypes,
      List<String> technologies) {}

  public record SearchMatchView(
      FileKnowledge record, int score, List<String> matchedTerms, List<String> matchedElements) {}

  public record SearchResponse(List<SearchMatchView> matches) {}

  public record PathInput(String path) {}

  public record FindRelatedInput(String path, Integer limit) {}

  public record RelatedResponse(List<RelatedFile> related) {}

  public record SearchByTypeInput(String fileType, String technology, String repo, Integer limit) {}

  public record FilesResponse(List<FileKnowledge> files) {}

  public record AnalyzeDependenciesInput(String path, Integer maxDepth) {}
}
