package com.gentoro.medigraph.sync;

import com.gentoro.medigraph.model.EntityType;

/** Outcome of one entity type in a pipeline run. */
public record EntityLoadResult(EntityType entityType, Status status, int extracted, int applied) {

  public enum Status {
    LOADED,
    SKIPPED
  }

  static EntityLoadResult loaded(EntityType entityType, int extracted, int applied) {
    return new EntityLoadResult(entityType, Status.LOADED, extracted, applied);
  }

  static EntityLoadResult skipped(EntityType entityType) {
    return new EntityLoadResult(entityType, Status.SKIPPED, 0, 0);
  }
}
