package com.codeknowledge.mcp.backend.knowledge.service;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Keyword ranking over knowledge records. Scores are integer sums per query term: a tag hit is
 * worth {@value #TAG_WEIGHT}, a summary hit {@value #SUMMARY_WEIGHT}, a key element hit
 * {@value #KEY_ELEMENT_WEIGHT} and a path hit {@value #PATH_WEIGHT}. Equal scores fall back to
 * recency and then path, so the output is fully determined by corpus and query.
 */
@Component
public class KnowledgeSearchEngine {

  static final int TAG_WEIGHT = 3;
  static final int SUMMARY_WEIGHT = 2;
  static final int KEY_ELEMENT_WEIGHT = 1;
  static final int PATH_WEIGHT = 1;

  static final Comparator<SearchHit> RANKING =
      Comparator.comparingInt(SearchHit::score)
          .reversed()
          .thenComparing(
              hit -> hit.record().indexedAt(),
              Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(hit -> hit.record().path());

  public List<SearchHit> search(Collection<FileKnowledge> corpus, SearchCriteria criteria) {
    Objects.requireNonNull(criteria, "criteria");
    List<String> terms = tokenize(criteria.query());
    if (terms.isEmpty()) {
      throw new InvalidQueryException("Search query must contain at least one term");
    }
    if (corpus == null || corpus.isEmpty() || criteria.limit() <= 0) {
      return List.of();
    }
    Set<String> tagFilter = normalizeTags(criteria.tags());
    List<SearchHit> hits = new ArrayList<>();
    for (FileKnowledge record : corpus) {
      if (!accepts(record, criteria, tagFilter)) {
        continue;
      }
      SearchHit hit = score(record, terms);
      if (hit.score() > 0) {
        hits.add(hit);
      }
    }
    hits.sort(RANKING);
    return hits.size() > criteria.limit() ? List.copyOf(hits.subList(0, criteria.limit())) : hits;
  }

  /** Lower-cases and splits on whitespace; repeated terms count once. */
  public static List<String> tokenize(String query) {
    if (!StringUtils.hasText(query)) {
      return List.of();
    }
    Set<String> terms = new LinkedHashSet<>();
    for (String token : query.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
      if (!token.isEmpty()) {
        terms.add(token);
      }
    }
    return List.copyOf(terms);
  }

  SearchHit score(FileKnowledge record, List<String> terms) {
    Set<String> tags =
        record.tags().stream()
            .filter(Objects::nonNull)
            .map(tag -> tag.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    String summary = lower(record.summary());
    String path = lower(record.path());
    List<String> keyElements =
        record.keyElements().stream().filter(Objects::nonNull).toList();

    int score = 0;
    List<String> matchedTerms = new ArrayList<>();
    Set<String> matchedElements = new LinkedHashSet<>();
    for (String term : terms) {
      int termScore = 0;
      if (tags.contains(term)) {
        termScore += TAG_WEIGHT;
      }
      if (summary.contains(term)) {
        termScore += SUMMARY_WEIGHT;
      }
      boolean elementHit = false;
      for (String element : keyElements) {
        if (element.toLowerCase(Locale.ROOT).contains(term)) {
          elementHit = true;
          matchedElements.add(element);
        }
      }
      if (elementHit) {
        termScore += KEY_ELEMENT_WEIGHT;
      }
      if (path.contains(term)) {
        termScore += PATH_WEIGHT;
      }
      if (termScore > 0) {
        matchedTerms.add(term);
        score += termScore;
      }
    }
    return new SearchHit(record, score, List.copyOf(matchedTerms), List.copyOf(matchedElements));
  }

  private boolean accepts(FileKnowledge record, SearchCriteria criteria, Set<String> tagFilter) {
    if (!criteria.repos().isEmpty() && !criteria.repos().contains(record.repo())) {
      return false;
    }
    if (!criteria.fileTypes().isEmpty() && !criteria.fileTypes().contains(record.fileType())) {
      return false;
    }
    if (!criteria.technologies().isEmpty()
        && !criteria.technologies().contains(record.technology())) {
      return false;
    }
    if (!tagFilter.isEmpty()) {
      return record.tags().stream()
          .filter(Objects::nonNull)
          .anyMatch(tag -> tagFilter.contains(tag.toLowerCase(Locale.ROOT)));
    }
    return true;
  }

  private Set<String> normalizeTags(List<String> tags) {
    if (CollectionUtils.isEmpty(tags)) {
      return Set.of();
    }
    return tags.stream()
        .filter(StringUtils::hasText)
        .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static String lower(String value) {
    return value != null ? value.toLowerCase(Locale.ROOT) : "";
  }

  /** Empty filter sets accept every record. */
  public record SearchCriteria(
      String query,
      int limit,
      Set<String> repos,
      Set<FileType> fileTypes,
      Set<Technology> technologies,
      List<String> tags) {

    public SearchCriteria {
      repos = repos != null ? Set.copyOf(repos) : Set.of();
      fileTypes = fileTypes != null ? Set.copyOf(fileTypes) : Set.of();
      technologies = technologies != null ? Set.copyOf(technologies) : Set.of();
    }
  }

  public record SearchHit(
      FileKnowledge record, int score, List<String> matchedTerms, List<String> matchedElements) {}
}
