package com.gentoro.medigraph.sync.mapping;

import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.RelationshipType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.plan.NodeRef;
import com.gentoro.medigraph.sync.plan.UpsertPlan;
import java.util.Optional;

/** Shared plumbing: key resolution and the "stub then link" step used for foreign references. */
abstract class AbstractEntityMapping implements EntityMapping {
  private final EntityType entityType;

  AbstractEntityMapping(EntityType entityType) {
    this.entityType = entityType;
  }

  @Override
  public EntityType entityType() {
    return entityType;
  }

  @Override
  public final Optional<UpsertPlan> plan(SourceRow row) {
    String key = ValueConverter.asText(row.get(entityType.keyColumn()));
    if (key == null) {
      return Optional.empty();
    }
    return build(row, NodeRef.of(entityType, key));
  }

  /** Build the plan once the row's own natural key is known. */
  abstract Optional<UpsertPlan> build(SourceRow row, NodeRef self);

  /** Reference to another entity named by a column, or null when the column is empty. */
  static NodeRef reference(SourceRow row, String column, EntityType target) {
    String key = ValueConverter.asText(row.get(column));
    return key == null ? null : NodeRef.of(target, key);
  }

  /** Merge a stub for {@code ref} (if present) and link {@code from -> ref}. */
  static void linkTo(UpsertPlan plan, NodeRef from, RelationshipType type, NodeRef ref) {
    if (ref == null) return;
    plan.stub(ref).edge(from, type, ref);
  }

  /** Merge a stub for {@code ref} (if present) and link {@code ref -> to}. */
  static void linkFrom(UpsertPlan plan, NodeRef ref, RelationshipType type, NodeRef to) {
    if (ref == null) return;
    plan.stub(ref).edge(ref, type, to);
  }
}
