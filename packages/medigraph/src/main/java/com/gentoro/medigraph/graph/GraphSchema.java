package com.gentoro.medigraph.graph;

import com.gentoro.medigraph.model.EntityType;
import java.util.Locale;

/**
 * Schema housekeeping: one uniqueness constraint per entity natural key. Constraints also back
 * the {@code MERGE} lookups with an index, so loads stay linear in batch size.
 */
public final class GraphSchema {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(GraphSchema.class);

  public static final String GUIDELINE_LABEL = "Guideline";

  private GraphSchema() {}

  /** Create missing constraints. Safe to run on every pipeline start. */
  public static void ensureConstraints(GraphSession session) {
    for (EntityType type : EntityType.values()) {
      session.write(uniqueKeyConstraint(type.label(), type.keyProperty()));
    }
    session.write(uniqueKeyConstraint(GUIDELINE_LABEL, "id"));
    log.debug("Natural-key constraints verified");
  }

  static String uniqueKeyConstraint(String label, String keyProperty) {
    String name = label.toLowerCase(Locale.ROOT) + "_" + keyProperty + "_unique";
    return "CREATE CONSTRAINT "
        + name
        + " IF NOT EXISTS FOR (n:"
        + label
        + ") REQUIRE n."
        + keyProperty
        + " IS UNIQUE";
  }
}
