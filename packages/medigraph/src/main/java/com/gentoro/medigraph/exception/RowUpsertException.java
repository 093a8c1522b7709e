package com.gentoro.medigraph.exception;

import com.gentoro.medigraph.model.EntityType;

/**
 * A single source row could not be applied to the graph. Aborts the rest of that entity type's
 * batch; rows applied before it stay committed.
 */
public class RowUpsertException extends MedigraphException {
  private final EntityType entityType;
  private final int rowIndex;
  private final Object naturalKey;

  public RowUpsertException(
      EntityType entityType, int rowIndex, Object naturalKey, String message, Throwable cause) {
    super(MedigraphErrorCode.ROW_UPSERT_ERROR, message, cause);
    this.entityType = entityType;
    this.rowIndex = rowIndex;
    this.naturalKey = naturalKey;
    withContext("entityType", entityType);
    withContext("row", rowIndex);
    withContext("key", naturalKey);
  }

  public EntityType getEntityType() {
    return entityType;
  }

  /** 1-based position of the failing row in its batch. */
  public int getRowIndex() {
    return rowIndex;
  }

  public Object getNaturalKey() {
    return naturalKey;
  }
}
