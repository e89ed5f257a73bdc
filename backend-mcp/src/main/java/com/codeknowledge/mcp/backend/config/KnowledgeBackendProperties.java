package com.codeknowledge.mcp.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "knowledge")
public class KnowledgeBackendProperties implements InitializingBean {

  private Search search = new Search();
  private Related related = new Related();
  private Graph graph = new Graph();
  private Validation validation = new Validation();
  private Batch batch = new Batch();

  @Override
  public void afterPropertiesSet() {
    if (search.getDefaultLimit() > search.getMaxLimit()) {
      throw new IllegalStateException(
          "knowledge.search.default-limit must not exceed knowledge.search.max-limit");
    }
    if (related.getDefaultLimit() > search.getMaxLimit()) {
      throw new IllegalStateException(
          "knowledge.related.default-limit must not exceed knowledge.search.max-limit");
    }
    if (graph.getDefaultMaxDepth() > graph.getMaxDepthLimit()) {
      throw new IllegalStateException(
          "knowledge.graph.default-max-depth must not exceed knowledge.graph.max-depth-limit");
    }
  }

  public Search getSearch() {
    return search;
  }

  public void setSearch(Search search) {
    this.search = search;
  }

  public Related getRelated() {
    return related;
  }

  public void setRelated(Related related) {
    this.related = related;
  }

  public Graph getGraph() {
    return graph;
  }

  public void setGraph(Graph graph) {
    this.graph = graph;
  }

  public Validation getValidation() {
    return validation;
  }

  public void setValidation(Validation validation) {
    this.validation = validation;
  }

  public Batch getBatch() {
    return batch;
  }

  public void setBatch(Batch batch) {
    this.batch = batch;
  }

  public static class Search {

    @Min(1)
    private int defaultLimit = 50;

    @Min(1)
    @Max(1000)
    private int maxLimit = 100;

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
      return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
      this.maxLimit = maxLimit;
    }
  }

  public static class Related {

    @Min(1)
    private int defaultLimit = 10;

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }
  }

  public static class Graph {

    @Min(0)
    private int defaultMaxDepth = 10;

    @Min(0)
    @Max(256)
    private int maxDepthLimit = 50;

    public int getDefaultMaxDepth() {
      return defaultMaxDepth;
    }

    public void setDefaultMaxDepth(int defaultMaxDepth) {
      this.defaultMaxDepth = defaultMaxDepth;
    }

    public int getMaxDepthLimit() {
      return maxDepthLimit;
    }

    public void setMaxDepthLimit(int maxDepthLimit) {
      this.maxDepthLimit = maxDepthLimit;
    }
  }

  public static class Validation {

    @Min(1)
    @Max(500)
    private int maxPathLength = 500;

    @Min(1)
    @Max(100)
    private int maxRepoLength = 100;

    @Min(1)
    private int maxSummaryLength = 10000;

    @Min(1)
    @Max(128)
    private int maxContentHashLength = 128;

    @Min(0)
    private int maxTags = 50;

    @Min(0)
    private int maxKeyElements = 500;

    @Min(0)
    private int maxDependencies = 500;

    public int getMaxPathLength() {
      return maxPathLength;
    }

    public void setMaxPathLength(int maxPathLength) {
      this.maxPathLength = maxPathLength;
    }

    public int getMaxRepoLength() {
      return maxRepoLength;
    }

    public void setMaxRepoLength(int maxRepoLength) {
      this.maxRepoLength = maxRepoLength;
    }

    public int getMaxSummaryLength() {
      return maxSummaryLength;
    }

    public void setMaxSummaryLength(int maxSummaryLength) {
      this.maxSummaryLength = maxSummaryLength;
    }

    public int getMaxContentHashLength() {
      return maxContentHashLength;
    }

    public void setMaxContentHashLength(int maxContentHashLength) {
      this.maxContentHashLength = maxContentHashLength;
    }

    public int getMaxTags() {
      return maxTags;
    }

    public void setMaxTags(int maxTags) {
      this.maxTags = maxTags;
    }

    public int getMaxKeyElements() {
      return maxKeyElements;
    }

    public void setMaxKeyElements(int maxKeyElements) {
      this.maxKeyElements = maxKeyElements;
    }

    public int getMaxDependencies() {
      return maxDependencies;
    }

    public void setMaxDependencies(int maxDependencies) {
      this.maxDependencies = maxDependencies;
    }
  }

  public static class Batch {

    @Min(1)
    @Max(5000)
    private int maxItems = 500;

    public int getMaxItems() {
      return maxItems;
    }

    public void setMaxItems(int maxItems) {
      this.maxItems = maxItems;
    }
  }
}
