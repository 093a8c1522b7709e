package com.gentoro.medigraph.sync.mapping;

import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.plan.UpsertPlan;
import java.util.Optional;

/** Translates one source row of a given entity type into graph operations. */
public interface EntityMapping {

  EntityType entityType();

  /**
   * Build the plan for a row, or empty when the row cannot identify its node and must be skipped.
   *
   * @throws IllegalArgumentException if a value in the row is malformed
   */
  Optional<UpsertPlan> plan(SourceRow row);
}
