package com.gentoro.medigraph.exception;

import java.util.Map;
import java.util.stream.Collectors;

/** Utility helpers for turning exceptions into operator-facing diagnostics. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Build a one-line diagnostic: the error code (for {@link MedigraphException}s), the message,
   * any attached context, and the innermost cause message when it adds information.
   */
  public static String describe(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    StringBuilder sb = new StringBuilder();
    if (t instanceof MedigraphException) {
      MedigraphException ex = (MedigraphException) t;
      sb.append('[').append(ex.getCode()).append("] ");
      sb.append(messageOrType(ex));
      Map<String, Object> context = ex.getContext();
      if (!context.isEmpty()) {
        sb.append(' ')
            .append(
                context.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", ", "{", "}")));
      }
    } else {
      sb.append(t.getClass().getSimpleName()).append(": ").append(messageOrType(t));
    }
    Throwable root = rootCause(t);
    if (root != t) {
      String rootMessage = messageOrType(root);
      if (sb.indexOf(rootMessage) < 0) {
        sb.append(" (caused by ")
            .append(root.getClass().getSimpleName())
            .append(": ")
            .append(rootMessage)
            .append(')');
      }
    }
    return sb.toString();
  }

  /** Innermost cause in the chain, or the throwable itself. */
  public static Throwable rootCause(Throwable t) {
    Throwable current = t;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current;
  }

  private static String messageOrType(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message.trim();
  }
}
