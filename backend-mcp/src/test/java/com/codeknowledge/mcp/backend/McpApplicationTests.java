package com.codeknowledge.mcp.backend;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(classes = McpApplication.class, webEnvironment = SpringBootTest.WebEnvironment.NONE)
class McpApplicationTests {

  @BeforeAll
  static void requireDocker() {
    PostgresTestContainer.assumeDockerAvailable();
  }

  @DynamicPropertySource
  static void datasource(DynamicPropertyRegistry registry) {
    PostgresTestContainer.register(registry);
  }

  @Autowired private ToolCallbackProvider knowledgeToolCallbackProvider;

  @Test
  void exposesAllKnowledgeTools() {
    assertThat(
            Arrays.stream(knowledgeToolCallbackProvider.getToolCallbacks())
                .map(ToolCallback::getToolDefinition)
                .map(definition -> definition.name()))
        .containsExactlyInAnyOrder(
            "knowledge.index_file",
            "knowledge.index_batch",
            "knowledge.search",
            "knowledge.get_file_context",
            "knowledge.find_related",
            "knowledge.search_by_type",
            "knowledge.get_stats",
            "knowledge.analyze_dependencies");
  }
}
