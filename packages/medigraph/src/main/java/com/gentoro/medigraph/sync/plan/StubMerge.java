package com.gentoro.medigraph.sync.plan;

import java.util.Objects;

/**
 * Merge-or-create a node by natural key only. Never writes attributes, so an existing, richer
 * node is left untouched and a new stub can be enriched by a later {@link NodeUpsert}.
 */
public record StubMerge(NodeRef node) implements PlanOperation {
  public StubMerge {
    Objects.requireNonNull(node, "node");
  }
}
