package com.gentoro.medigraph;

import com.gentoro.medigraph.exception.ConfigurationException;
import java.util.Locale;

/** What a process invocation does, selected with {@code --mode}. */
public enum Mode {
  /** The batch job: extract every entity type and upsert it into the graph. */
  LOAD("load"),
  /** Answer one question given with {@code --question}. */
  ASK("ask"),
  STATS("stats"),
  SEED_GUIDELINES("seed-guidelines");

  private final String id;

  Mode(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /** Null or blank selects {@link #LOAD}. */
  public static Mode fromParameter(String value) {
    if (value == null || value.isBlank()) return LOAD;
    String wanted = value.trim().toLowerCase(Locale.ROOT);
    for (Mode mode : values()) {
      if (mode.id.equals(wanted)) return mode;
    }
    throw new ConfigurationException(
        "Invalid mode: " + value + " (expected load, ask, stats or seed-guidelines)");
  }
}
