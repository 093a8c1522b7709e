package com.gentoro.medigraph.exception;

import com.gentoro.medigraph.model.EntityType;

/** An extract failed or returned a column set that no longer matches the expected view. */
public class SourceQueryException extends MedigraphException {
  private final EntityType entityType;

  public SourceQueryException(EntityType entityType, String message) {
    super(MedigraphErrorCode.SOURCE_QUERY_ERROR, message);
    this.entityType = entityType;
    withContext("entityType", entityType);
  }

  public SourceQueryException(EntityType entityType, String message, Throwable cause) {
    super(MedigraphErrorCode.SOURCE_QUERY_ERROR, message, cause);
    this.entityType = entityType;
    withContext("entityType", entityType);
  }

  public EntityType getEntityType() {
    return entityType;
  }
}
