package com.gentoro.medigraph.source;

import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import java.util.List;

/** Reads a bounded batch of raw rows for one entity type from the source system. Read-only. */
public interface Extractor {

  /**
   * Fetch at most {@code maxRows} rows. The cap is applied by the source query itself, never
   * after transfer. Observation rows come back in ascending timestamp order; other types have no
   * guaranteed order.
   *
   * @throws com.gentoro.medigraph.exception.SourceQueryException if the extract fails or the
   *     expected columns are missing
   * @throws com.gentoro.medigraph.exception.SourceUnavailableException if the connection is gone
   */
  List<SourceRow> fetch(EntityType entityType, int maxRows);
}
