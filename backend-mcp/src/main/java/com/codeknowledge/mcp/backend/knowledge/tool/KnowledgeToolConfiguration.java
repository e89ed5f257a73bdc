package com.codeknowledge.mcp.backend.knowledge.tool;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class KnowledgeToolConfiguration {

  @Bean
  ToolCallbackProvider knowledgeToolCallbackProvider(KnowledgeTools knowledgeTools) {
    return MethodToolCallbackProvider.builder().toolObjects(knowledgeTools).build();
  }
}
