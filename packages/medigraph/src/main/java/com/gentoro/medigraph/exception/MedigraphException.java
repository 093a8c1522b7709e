package com.gentoro.medigraph.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Base unchecked exception for every failure raised by the sync pipeline and query router. */
public class MedigraphException extends RuntimeException {
  private final MedigraphErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public MedigraphException(MedigraphErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public MedigraphException(MedigraphErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public MedigraphErrorCode getCode() {
    return code;
  }

  /** Attach a diagnostic attribute; returns this for chaining. */
  public MedigraphException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}
