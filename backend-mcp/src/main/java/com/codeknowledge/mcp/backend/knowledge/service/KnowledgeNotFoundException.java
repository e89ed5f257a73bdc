package com.codeknowledge.mcp.backend.knowledge.service;

public class KnowledgeNotFoundException extends KnowledgeBaseException {

  public KnowledgeNotFoundException(String path) {
    super("File is not indexed: " + path);
  }

  @Override
  public String errorType() {
    return "NOT_FOUND";
  }
}
