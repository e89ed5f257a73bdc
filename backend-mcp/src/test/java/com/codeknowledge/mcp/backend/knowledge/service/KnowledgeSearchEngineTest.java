package com.codeknowledge.mcp.backend.knowledge.service;

import static com.codeknowledge.mcp.backend.knowledge.service.KnowledgeFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeSearchEngine.SearchCriteria;
import com.codeknowledge.mcp.backend.knowledge.service.KnowledgeSearchEngine.SearchHit;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KnowledgeSearchEngineTest {

  private final KnowledgeSearchEngine engine = new KnowledgeSearchEngine();

  private final FileKnowledge storageBicep =
      record("/emperion/infra/a.bicep")
          .summary("Provisions the storage account")
          .keyElements("storageAccount", "keyVault")
          .tags("storage", "azure")
          .build();

  private final FileKnowledge storageDoc =
      record("/emperion/notes/storage.md")
          .repo("notes")
          .fileType(FileType.MARKDOWN)
          .technology(Technology.DOCUMENTATION)
          .summary("Notes on Azure storage limits")
          .tags("docs")
          .indexedAtOffset(60)
          .build();

  private final FileKnowledge helmChart =
      record("/emperion/DevOps/chart.yaml")
          .repo("DevOps")
          .fileType(FileType.HELM)
          .technology(Technology.DEVOPS)
          .summary("Helm chart for the intake api")
          .tags("helm")
          .build();

  private final List<FileKnowledge> corpus = List.of(helmChart, storageDoc, storageBicep);

  @Test
  void tagHitsRankAboveSummaryHits() {
    List<SearchHit> hits = engine.search(corpus, criteria("azure storage", 50));

    assertThat(hits).extracting(hit -> hit.record().path())
        .containsExactly("/emperion/infra/a.bicep", "/emperion/notes/storage.md");
    SearchHit first = hits.get(0);
    // azure: tag 3; storage: tag 3 + summary 2 + key element 1
    assertThat(first.score()).isEqualTo(9).isGreaterThanOrEqualTo(6);
    assertThat(first.matchedTerms()).containsExactly("azure", "storage");
    assertThat(first.matchedElements()).containsExactly("storageAccount");
    // azure: summary 2; storage: summary 2 + path 1
    assertThat(hits.get(1).score()).isEqualTo(5);
  }

  @Test
  void recordsWithoutAnyHitAreExcluded() {
    List<SearchHit> hits = engine.search(corpus, criteria("keyvault", 50));

    assertThat(hits).singleElement().satisfies(hit -> {
      assertThat(hit.record()).isEqualTo(storageBicep);
      assertThat(hit.score()).isEqualTo(1);
    });
  }

  @Test
  void repeatedSearchesReturnIdenticalNonIncreasingResults() {
    List<SearchHit> first = engine.search(corpus, criteria("storage azure helm chart", 50));
    List<SearchHit> second = engine.search(corpus, criteria("storage azure helm chart", 50));

    assertThat(first).isEqualTo(second);
    for (int i = 1; i < first.size(); i++) {
      assertThat(first.get(i).score()).isLessThanOrEqualTo(first.get(i - 1).score());
    }
  }

  @Test
  void tiesAreBrokenByRecencyThenPath() {
    FileKnowledge older = record("/repo/b.tf").summary("network").indexedAtOffset(0).build();
    FileKnowledge newer = record("/repo/c.tf").summary("network").indexedAtOffset(30).build();
    FileKnowledge sameTimeLowerPath =
        record("/repo/a.tf").summary("network").indexedAtOffset(0).build();

    List<SearchHit> hits =
        engine.search(List.of(older, newer, sameTimeLowerPath), criteria("network", 50));

    assertThat(hits).extracting(hit -> hit.record().path())
        .containsExactly("/repo/c.tf", "/repo/a.tf", "/repo/b.tf");
  }

  @Test
  void appliesCategoryAndTagFilters() {
    SearchCriteria byType =
        new SearchCriteria("storage", 50, null, Set.of(FileType.MARKDOWN), null, null);
    assertThat(engine.search(corpus, byType)).extracting(hit -> hit.record().path())
        .containsExactly("/emperion/notes/storage.md");

    SearchCriteria byTag =
        new SearchCriteria("storage", 50, null, null, null, List.of("AZURE"));
    assertThat(engine.search(corpus, byTag)).extracting(hit -> hit.record().path())
        .containsExactly("/emperion/infra/a.bicep");

    SearchCriteria byRepo = new SearchCriteria("storage", 50, Set.of("DevOps"), null, null, null);
    assertThat(engine.search(corpus, byRepo)).isEmpty();

    SearchCriteria anyOfTypes =
        new SearchCriteria(
            "storage helm", 50, null, Set.of(FileType.MARKDOWN, FileType.HELM), null, null);
    assertThat(engine.search(corpus, anyOfTypes)).extracting(hit -> hit.record().path())
        .containsExactlyInAnyOrder("/emperion/notes/storage.md", "/emperion/DevOps/chart.yaml");

    SearchCriteria anyOfRepos =
        new SearchCriteria(
            "storage helm",
            50,
            Set.of("notes", "azure-iac"),
            null,
            Set.of(Technology.DOCUMENTATION, Technology.DEVOPS),
            null);
    assertThat(engine.search(corpus, anyOfRepos)).extracting(hit -> hit.record().path())
        .containsExactly("/emperion/notes/storage.md");
  }

  @Test
  void truncatesToLimit() {
    assertThat(engine.search(corpus, criteria("storage", 1))).hasSize(1);
  }

  @Test
  void duplicateQueryTermsCountOnce() {
    int single = engine.search(corpus, criteria("azure", 50)).get(0).score();
    int repeated = engine.search(corpus, criteria("Azure  AZURE azure", 50)).get(0).score();

    assertThat(repeated).isEqualTo(single);
  }

  @Test
  void rejectsBlankQuery() {
    assertThatThrownBy(() -> engine.search(corpus, criteria("   \t ", 10)))
        .isInstanceOf(InvalidQueryException.class);
    assertThat(KnowledgeSearchEngine.tokenize(null)).isEmpty();
  }

  private SearchCriteria criteria(String query, int limit) {
    return new SearchCriteria(query, limit, null, null, null, null);
  }
}
