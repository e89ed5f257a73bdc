package com.codeknowledge.mcp.backend.knowledge.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.codeknowledge.mcp.backend.knowledge.persistence")
@EntityScan(basePackages = "com.codeknowledge.mcp.backend.knowledge.persistence")
public class KnowledgeConfiguration {}
