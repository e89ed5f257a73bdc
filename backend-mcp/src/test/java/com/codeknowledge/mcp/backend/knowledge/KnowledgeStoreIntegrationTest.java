package com.codeknowledge.mcp.backend.knowledge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeknowledge.mcp.backend.McpApplication;
import com.codeknowledge.mcp.backend.PostgresTestContainer;
import com.codeknowledge.mcp.backend.knowledge.model.IndexOutcome;
import com.codeknowledge.mcp.backend.knowledge.service.CategoryIndex;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeNotFoundException;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.BatchItemResult;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.IndexFileCommand;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.IndexResult;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.SearchByTypeCommand;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeQueryService.SearchCommand;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeSearchEngine.SearchHit;
import com.codeknowledge.mcp.backend.knowledge.tool.KnowledgeTools;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(classes = McpApplication.class, webEnvironment = SpringBootTest.WebEnvironment.NONE)
class KnowledgeStoreIntegrationTest {

  private static ExecutorService executor;

  @BeforeAll
  static void setUpAll() {
    PostgresTestContainer.assumeDockerAvailable();
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterAll
  static void tearDownAll() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @DynamicPropertySource
  static void registerDatasourceProperties(DynamicPropertyRegistry registry) {
    PostgresTestContainer.register(registry);
  }

  @Autowired private KnowledgeQueryService queryService;

  @Autowired private KnowledgeTools knowledgeTools;

  @Autowired private JdbcTemplate jdbcTemplate;

  @Autowired private ObjectMapper objectMapper;

  @BeforeEach
  void cleanTable() {
    jdbcTemplate.update("DELETE FROM file_knowledge");
  }

  @Test
  void reindexWithSameHashIsNoOp() {
    IndexResult first = queryService.indexFile(command("main.bicep", "hash-1", "Main template"));
    IndexResult second = queryService.indexFile(command("main.bicep", "hash-1", "Edited summary"));

    assertThat(first.outcome()).isEqualTo(IndexOutcome.CREATED);
    assertThat(second.outcome()).isEqualTo(IndexOutcome.UNCHANGED);
    assertThat(second.record().indexedAt()).isEqualTo(first.record().indexedAt());
    assertThat(second.record().summary()).isEqualTo("Main template");
    assertThat(rowCount()).isEqualTo(1);
  }

  @Test
  void reindexWithNewHashReplacesRecordAndKeepsCreationTime() throws Exception {
    IndexResult first = queryService.indexFile(command("main.bicep", "hash-1", "Main template"));
    Thread.sleep(5);
    IndexResult second = queryService.indexFile(command("main.bicep", "hash-2", "Rewritten"));

    assertThat(second.outcome()).isEqualTo(IndexOutcome.REPLACED);
    assertThat(second.record().summary()).isEqualTo("Rewritten");
    assertThat(second.record().contentHash()).isEqualTo("hash-2");
    assertThat(second.record().indexedAt()).isAfter(first.record().indexedAt());
    assertThat(second.record().createdAt()).isEqualTo(first.record().createdAt());
    assertThat(rowCount()).isEqualTo(1);
  }

  @Test
  void batchStoresValidItemsDespiteInvalidOne() {
    List<BatchItemResult> results =
        queryService.indexBatch(
            List.of(
                command("valid1.bicep", "h1", "First"),
                command("invalid.bicep", "h2", ""),
                command("valid2.bicep", "h3", "Second")));

    assertThat(results)
        .extracting(BatchItemResult::outcome)
        .containsExactly(IndexOutcome.CREATED, null, IndexOutcome.CREATED);
    assertThat(results.get(1).error().errorType()).isEqualTo("VALIDATION_ERROR");
    assertThat(rowCount()).isEqualTo(2);
    assertThatThrownBy(() -> queryService.getFileContext("invalid.bicep"))
        .isInstanceOf(KnowledgeNotFoundException.class);
  }

  @Test
  void statsMatchStoredRecords() {
    queryService.indexFile(command("main.bicep", "h1", "Main template"));
    queryService.indexFile(
        new IndexFileCommand(
            "deploy.sh",
            "devops-scripts",
            "bash",
            "devops",
            "Deploys the stack",
            List.of(),
            List.of("main.bicep"),
            List.of("deploy"),
            "h2",
            null));

    CategoryIndex stats = queryService.getStats();

    assertThat(stats.totalCount()).isEqualTo(2);
    assertThat(stats.byRepo()).containsEntry("azure-iac", 1L).containsEntry("devops-scripts", 1L);
    assertThat(stats.byFileType()).containsEntry("bicep", 1L).containsEntry("bash", 1L);
    assertThat(stats.byTechnology()).containsEntry("devops", 1L);
    assertThat(stats.byRepo().values().stream().mapToLong(Long::longValue).sum())
        .isEqualTo(stats.totalCount());
    assertThat(stats.totalDependencies()).isEqualTo(1);

    assertThat(queryService.getFileContext("main.bicep").dependents())
        .containsExactly("deploy.sh");
    assertThat(queryService.searchByType(new SearchByTypeCommand("bash", null, null, null)))
        .extracting(record -> record.path())
        .containsExactly("deploy.sh");
  }

  @Test
  void searchRanksTagMatchesFirst() {
    queryService.indexFile(
        new IndexFileCommand(
            "/emperion/infra/a.bicep",
            "azure-iac",
            "bicep",
            "infrastructure-as-code",
            "Provisions the storage account",
            List.of("storageAccount"),
            List.of(),
            List.of("storage", "azure"),
            "h1",
            null));
    queryService.indexFile(command("/emperion/infra/network.bicep", "h2", "Virtual network"));

    List<SearchHit> hits =
        queryService.search(new SearchCommand("azure storage", null, null, null, null, null));

    assertThat(hits).isNotEmpty();
    assertThat(hits.get(0).record().path()).isEqualTo("/emperion/infra/a.bicep");
    assertThat(hits.get(0).score()).isGreaterThanOrEqualTo(6);
  }

  @Test
  void metadataRoundTripsThroughTools() {
    KnowledgeTools.IndexFileResponse response =
        knowledgeTools.indexFile(
            new KnowledgeTools.IndexFileInput(
                "values.yaml",
                "charts",
                "helm",
                "devops",
                "Chart values",
                List.of(),
                List.of(),
                List.of(),
                "h1",
                Map.of("lines", 42)));

    assertThat(response.outcome()).isEqualTo("created");
    assertThat(response.record().metadata().path("lines").asInt()).isEqualTo(42);
    assertThat(objectMapper.valueToTree(response.record()).path("fileType").asText())
        .isEqualTo("helm");
  }

  @Test
  void concurrentIndexingOfOnePathCreatesOneRecord() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    Callable<IndexOutcome> task =
        () -> {
          start.await();
          return queryService.indexFile(command("race.bicep", "same", "Race")).outcome();
        };
    Future<IndexOutcome> first = executor.submit(task);
    Future<IndexOutcome> second = executor.submit(task);
    start.countDown();

    List<IndexOutcome> outcomes =
        List.of(first.get(30, TimeUnit.SECONDS), second.get(30, TimeUnit.SECONDS));

    assertThat(outcomes).containsExactlyInAnyOrder(IndexOutcome.CREATED, IndexOutcome.UNCHANGED);
    assertThat(rowCount()).isEqualTo(1);
  }

  @Test
  void concurrentReplacesLeaveOneConsistentRecord() throws Exception {
    queryService.indexFile(command("shared.bicep", "h1", "Original"));
    Map<String, String> summaryByHash = Map.of("h2", "Second writer", "h3", "Third writer");
    CountDownLatch start = new CountDownLatch(1);
    List<Future<IndexResult>> writers =
        summaryByHash.entrySet().stream()
            .map(
                entry ->
                    executor.submit(
                        () -> {
                          start.await();
                          return queryService.indexFile(
                              command("shared.bicep", entry.getKey(), entry.getValue()));
                        }))
            .toList();
    start.countDown();

    for (Future<IndexResult> writer : writers) {
      IndexResult result = writer.get(30, TimeUnit.SECONDS);
      assertThat(result.outcome()).isIn(IndexOutcome.REPLACED, IndexOutcome.UNCHANGED);
      assertThat(result.record().summary())
          .isEqualTo(summaryByHash.get(result.record().contentHash()));
    }

    assertThat(rowCount()).isEqualTo(1);
    Map<String, Object> row =
        jdbcTemplate.queryForMap(
            "SELECT content_hash, summary FROM file_knowledge WHERE path = ?", "shared.bicep");
    assertThat(summaryByHash).containsKey((String) row.get("content_hash"));
    assertThat(row.get("summary")).isEqualTo(summaryByHash.get((String) row.get("content_hash")));
  }

  @Test
  void blankPathLookupsDoNotFailValidation() {
    queryService.indexFile(command("main.bicep", "h1", "Main template"));

    assertThatThrownBy(() -> queryService.getFileContext(""))
        .isInstanceOf(KnowledgeNotFoundException.class);
    assertThat(queryService.analyzeDependencies("", null).depthMap()).isEmpty();
    assertThat(queryService.getFileContext("main.bicep").record().path()).isEqualTo("main.bicep");
  }

  private int rowCount() {
    Integer count =
        jdbcTemplate.queryForObject("SELECT count(*) FROM file_knowledge", Integer.class);
    return count != null ? count : 0;
  }

  private IndexFileCommand command(String path, String hash, String summary) {
    return new IndexFileCommand(
        path,
        "azure-iac",
        "bicep",
        "infrastructure-as-code",
        summary,
        List.of(),
        List.of(),
        List.of("azure"),
        hash,
        null);
  }
}
