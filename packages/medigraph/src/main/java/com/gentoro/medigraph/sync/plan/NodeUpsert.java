package com.gentoro.medigraph.sync.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Merge-or-create a node and overwrite its scalar attributes with the row's values. A null value
 * clears the attribute, so repeated loads converge to the latest observed row.
 */
public record NodeUpsert(NodeRef node, Map<String, Object> properties) implements PlanOperation {
  public NodeUpsert {
    Objects.requireNonNull(node, "node");
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }
}
