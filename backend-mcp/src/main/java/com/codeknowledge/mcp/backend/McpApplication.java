package com.codeknowledge.mcp.backend;

import com.codeknowledge.mcp.backend.config.KnowledgeBackendProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(
    scanBasePackages = {
      "com.codeknowledge.mcp.backend.knowledge",
      "com.codeknowledge.mcp.backend.config"
    })
@EnableConfigurationProperties(KnowledgeBackendProperties.class)
public class McpApplication {

  public static void main(String[] args) {
    SpringApplication.run(McpApplication.class, args);
  }
}
