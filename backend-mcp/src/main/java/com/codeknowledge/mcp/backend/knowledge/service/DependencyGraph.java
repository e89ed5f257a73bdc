package com.codeknowledge.mcp.backend.knowledge.service;

import com.codeknowledge.mcp.backend.knowledge.model.FileKnowledge;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory directed graph over declared dependencies. An edge {@code A -> B} means that record A
 * lists B among its dependencies. Targets without a record of their own are kept as plain nodes, so
 * forward references never fail a query.
 */
public final class DependencyGraph {

  private final Map<String, List<String>> outgoing;
  private final Map<String, Set<String>> incoming;

  private DependencyGraph(
      Map<String, List<String>> outgoing, Map<String, Set<String>> incoming) {
    this.outgoing = outgoing;
    this.incoming = incoming;
  }

  public static DependencyGraph build(Collection<FileKnowledge> records) {
    Objects.requireNonNull(records, "records");
    Map<String, List<String>> outgoing = new HashMap<>();
    Map<String, Set<String>> incoming = new HashMap<>();
    for (FileKnowledge record : records) {
      List<String> targets = record.dependencies();
      outgoing.put(record.path(), targets);
      for (String target : targets) {
        if (target == null) {
          continue;
        }
        incoming.computeIfAbsent(target, key -> new TreeSet<>()).add(record.path());
      }
    }
    return new DependencyGraph(outgoing, incoming);
  }

  public boolean hasRecord(String path) {
    return outgoing.containsKey(path);
  }

  /** The record's own dependency list, empty when the path is not indexed. */
  public List<String> directDependencies(String path) {
    return outgoing.getOrDefault(path, List.of());
  }

  /** Indexed paths that declare {@code path} as a dependency, sorted by path. */
  public List<String> directDependents(String path) {
    Set<String> sources = incoming.get(path);
    return sources != null ? List.copyOf(sources) : List.of();
  }

  /**
   * Breadth-first walk along dependency edges. The root is at depth 0 and each node keeps the depth
   * of its first visit; visited nodes are never enqueued again, which also terminates cycles. Nodes
   * deeper than {@code maxDepth} are not reported.
   */
  public Map<String, Integer> transitiveDepth(String path, int maxDepth) {
    Objects.requireNonNull(path, "path");
    int limit = Math.max(0, maxDepth);
    Map<String, Integer> depths = new LinkedHashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    depths.put(path, 0);
    queue.add(path);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int depth = depths.get(current);
      if (depth >= limit) {
        continue;
      }
      for (String next : directDependencies(current)) {
        if (next != null && !depths.containsKey(next)) {
          depths.put(next, depth + 1);
          queue.add(next);
        }
      }
    }
    return Collections.unmodifiableMap(depths);
  }

  public Analysis analyze(String path, int maxDepth) {
    Map<String, Integer> depthMap = transitiveDepth(path, maxDepth);
    int deepest = depthMap.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    List<String> unresolved = new ArrayList<>();
    for (String node : depthMap.keySet()) {
      if (!hasRecord(node)) {
        unresolved.add(node);
      }
    }
    return new Analysis(
        path,
        hasRecord(path),
        directDependencies(path),
        directDependents(path),
        depthMap,
        deepest,
        List.copyOf(unresolved));
  }

  public record Analysis(
      String root,
      boolean indexed,
      List<String> dependencies,
      List<String> dependents,
      Map<String, Integer> depthMap,
      int depth,
      List<String> unresolved) {

    static Analysis empty(String root) {
      return new Analysis(root, false, List.of(), List.of(), Map.of(), 0, List.of());
    }
  }
}
