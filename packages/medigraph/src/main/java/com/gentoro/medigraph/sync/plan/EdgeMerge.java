package com.gentoro.medigraph.sync.plan;

import com.gentoro.medigraph.model.RelationshipType;
import java.util.Objects;

/** Merge a directed relationship; creating the same edge twice is a no-op. */
public record EdgeMerge(NodeRef from, RelationshipType type, NodeRef to) implements PlanOperation {
  public EdgeMerge {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(to, "to");
  }
}
