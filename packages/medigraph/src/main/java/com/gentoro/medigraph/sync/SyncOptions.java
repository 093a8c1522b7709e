package com.gentoro.medigraph.sync;

import org.apache.commons.configuration2.Configuration;

/** Tunables for a pipeline run, read from {@code load.*}. */
public record SyncOptions(int maxRowsPerEntity, int progressInterval, boolean skipLoadedTypes) {

  public static final int DEFAULT_MAX_ROWS = 7000;
  public static final int DEFAULT_PROGRESS_INTERVAL = 500;

  public SyncOptions {
    if (maxRowsPerEntity < 0) {
      throw new IllegalArgumentException("load.maxRowsPerEntity must be >= 0");
    }
  }

  public static SyncOptions defaults() {
    return new SyncOptions(DEFAULT_MAX_ROWS, DEFAULT_PROGRESS_INTERVAL, true);
  }

  public static SyncOptions fromConfiguration(Configuration configuration) {
    return new SyncOptions(
        configuration.getInt("load.maxRowsPerEntity", DEFAULT_MAX_ROWS),
        configuration.getInt("load.progressInterval", DEFAULT_PROGRESS_INTERVAL),
        configuration.getBoolean("load.skipLoadedTypes", true));
  }
}
