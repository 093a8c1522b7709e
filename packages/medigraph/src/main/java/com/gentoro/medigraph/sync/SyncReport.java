package com.gentoro.medigraph.sync;

import com.gentoro.medigraph.model.EntityType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Per-entity outcomes of a pipeline run, in load order. */
public class SyncReport {
  private final List<EntityLoadResult> results = new ArrayList<>();

  void add(EntityLoadResult result) {
    results.add(result);
  }

  public List<EntityLoadResult> results() {
    return Collections.unmodifiableList(results);
  }

  public Optional<EntityLoadResult> result(EntityType entityType) {
    return results.stream().filter(r -> r.entityType() == entityType).findFirst();
  }

  public int totalApplied() {
    return results.stream().mapToInt(EntityLoadResult::applied).sum();
  }

  public String summary() {
    StringBuilder sb = new StringBuilder();
    for (EntityLoadResult r : results) {
      if (sb.length() > 0) sb.append(", ");
      sb.append(r.entityType().pluralName()).append('=');
      if (r.status() == EntityLoadResult.Status.SKIPPED) {
        sb.append("skipped");
      } else {
        sb.append(r.applied()).append('/').append(r.extracted());
      }
    }
    return sb.toString();
  }
}
