package com.codeknowledge.mcp.backend.knowledge.service;

public class InvalidQueryException extends KnowledgeBaseException {

  public InvalidQueryException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "INVALID_QUERY";
  }
}
