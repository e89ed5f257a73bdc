package com.codeknowledge.mcp.backend.knowledge.persistence;

import com.codeknowledge.mcp.backend.knowledge.model.FileType;
import com.codeknowledge.mcp.backend.knowledge.model.Technology;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface FileKnowledgeRepository extends JpaRepository<FileKnowledgeEntity, UUID> {

  Optional<FileKnowledgeEntity> findByPath(String path);

  List<FileKnowledgeEntity> findByPathIn(Collection<String> paths);

  @Query(
      """
      select f from FileKnowledgeEntity f
      where (:repo is null or f.repo = :repo)
        and (:fileType is null or f.fileType = :fileType)
        and (:technology is null or f.technology = :technology)
      """)
  List<FileKnowledgeEntity> findFiltered(
      @Param("repo") String repo,
      @Param("fileType") FileType fileType,
      @Param("technology") Technology technology,
      Sort sort);

  @Query(
      """
      select f from FileKnowledgeEntity f
      where (:repo is null or f.repo = :repo)
        and (:fileType is null or f.fileType = :fileType)
        and (:technology is null or f.technology = :technology)
      """)
  List<FileKnowledgeEntity> findFilteredPage(
      @Param("repo") String repo,
      @Param("fileType") FileType fileType,
      @Param("technology") Technology technology,
      Pageable pageable);
}
