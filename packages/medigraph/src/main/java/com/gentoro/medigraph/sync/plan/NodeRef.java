package com.gentoro.medigraph.sync.plan;

import com.gentoro.medigraph.model.EntityType;
import java.util.Objects;

/** Identity of a graph node: label plus natural-key property and value. */
public record NodeRef(String label, String keyProperty, Object key) {
  public NodeRef {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(keyProperty, "keyProperty");
    Objects.requireNonNull(key, "key");
  }

  public static NodeRef of(EntityType type, Object key) {
    return new NodeRef(type.label(), type.keyProperty(), key);
  }
}
