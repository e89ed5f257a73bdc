package com.codeknowledge.mcp.backend.knowledge.service;

public class KnowledgeValidationException extends KnowledgeBaseException {

  public KnowledgeValidationException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "VALIDATION_ERROR";
  }
}
