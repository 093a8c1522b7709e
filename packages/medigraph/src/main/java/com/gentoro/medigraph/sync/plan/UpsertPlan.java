package com.gentoro.medigraph.sync.plan;

import com.gentoro.medigraph.model.RelationshipType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered graph operations derived from a single source row. Applied atomically.
 *
 * <p>An edge may only be added once both of its endpoints have been declared in the plan (by an
 * upsert or a stub merge), so a rendered plan can never create a dangling relationship.
 */
public final class UpsertPlan {
  private final List<PlanOperation> operations = new ArrayList<>();
  private final Set<NodeRef> declared = new HashSet<>();

  public UpsertPlan upsert(NodeRef node, Map<String, Object> properties) {
    operations.add(new NodeUpsert(node, properties));
    declared.add(node);
    return this;
  }

  public UpsertPlan stub(NodeRef node) {
    operations.add(new StubMerge(node));
    declared.add(node);
    return this;
  }

  public UpsertPlan edge(NodeRef from, RelationshipType type, NodeRef to) {
    if (!declared.contains(from) || !declared.contains(to)) {
      throw new IllegalStateException(
          "Edge " + type + " references an undeclared endpoint: " + from + " -> " + to);
    }
    operations.add(new EdgeMerge(from, type, to));
    return this;
  }

  public List<PlanOperation> operations() {
    return Collections.unmodifiableList(operations);
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }
}
