package com.codeknowledge.mcp.backend.knowledge.service;

/** Base type of the errors returned to tool callers; {@link #errorType()} is a stable code. */
public abstract class KnowledgeBaseException extends RuntimeException {

  protected KnowledgeBaseException(String message) {
    super(message);
  }

  public abstract String errorType();
}
