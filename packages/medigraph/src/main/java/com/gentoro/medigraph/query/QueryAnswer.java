package com.gentoro.medigraph.query;

import java.util.Objects;
import java.util.Optional;

/** What a question produced: a message for the user and, when rows matched, the table. */
public final class QueryAnswer {
  private final String message;
  private final Intent intent;
  private final ResultTable table;

  private QueryAnswer(String message, Intent intent, ResultTable table) {
    this.message = Objects.requireNonNull(message, "message");
    this.intent = intent;
    this.table = table;
  }

  public static QueryAnswer withTable(String message, Intent intent, ResultTable table) {
    return new QueryAnswer(message, intent, Objects.requireNonNull(table, "table"));
  }

  public static QueryAnswer messageOnly(String message, Intent intent) {
    return new QueryAnswer(message, intent, null);
  }

  public String message() {
    return message;
  }

  /** Routed intent; empty for help text and for translated queries. */
  public Optional<Intent> intent() {
    return Optional.ofNullable(intent);
  }

  public Optional<ResultTable> table() {
    return Optional.ofNullable(table);
  }

  @Override
  public String toString() {
    return "QueryAnswer[" + message + (table == null ? "" : ", " + table) + "]";
  }
}
