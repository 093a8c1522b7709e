package com.gentoro.medigraph.stats;

import java.util.Map;

/**
 * Snapshot of graph size. Both maps iterate in the order they should be shown: nodes by
 * entity label, relationships by count descending.
 */
public record GraphStatistics(Map<String, Long> nodeCounts, Map<String, Long> relationshipCounts) {

  public long totalNodes() {
    return nodeCounts.values().stream().mapToLong(Long::longValue).sum();
  }

  public long totalRelationships() {
    return relationshipCounts.values().stream().mapToLong(Long::longValue).sum();
  }
}
