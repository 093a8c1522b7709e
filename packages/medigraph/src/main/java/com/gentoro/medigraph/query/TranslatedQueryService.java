package com.gentoro.medigraph.query;

import com.gentoro.medigraph.exception.ExceptionUtil;
import com.gentoro.medigraph.exception.QueryExecutionException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Answers questions with Cypher produced by a {@link QueryTranslator}. The text is cleaned of
 * Markdown fences, refused if it would write, and run read-only. Failures degrade to the same
 * soft message as the routed path.
 */
public class TranslatedQueryService {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(TranslatedQueryService.class);

  private static final Pattern WRITE_CLAUSE =
      Pattern.compile(
          "\\b(CREATE|MERGE|DELETE|DETACH|SET|REMOVE|DROP|FOREACH|LOAD\\s+CSV)\\b|\\bCALL\\s*\\{",
          Pattern.CASE_INSENSITIVE);

  public static final String NO_ROWS_MESSAGE = "The query ran but returned no rows.";

  private final GraphStore graphStore;
  private final QueryTranslator translator;

  public TranslatedQueryService(GraphStore graphStore, QueryTranslator translator) {
    this.graphStore = Objects.requireNonNull(graphStore, "graphStore");
    this.translator = Objects.requireNonNull(translator, "translator");
  }

  public QueryAnswer answer(String question) {
    try {
      String cypher = sanitize(translate(question));
      log.debug("Translated '{}' to: {}", question, cypher);
      List<Map<String, Object>> records = execute(cypher);
      if (records.isEmpty()) {
        return QueryAnswer.messageOnly(NO_ROWS_MESSAGE, null);
      }
      ResultTable table = ResultProjector.projectByKeys(records);
      return QueryAnswer.withTable("Results:", null, table);
    } catch (QueryExecutionException e) {
      log.warn("Translated question '{}' failed: {}", question, ExceptionUtil.describe(e));
      return QueryAnswer.messageOnly(QuestionAnsweringService.SOFT_FAILURE_MESSAGE, null);
    }
  }

  /**
   * Strip a surrounding Markdown code fence and its optional {@code cypher} language tag, then
   * reject anything that is empty or contains an updating clause.
   */
  static String sanitize(String raw) {
    if (raw == null) {
      throw new QueryExecutionException("Translator returned no query");
    }
    String cypher = raw.trim();
    if (cypher.startsWith("```")) {
      cypher = stripBackticks(cypher);
      if (cypher.toLowerCase(Locale.ROOT).startsWith("cypher")) {
        cypher = cypher.substring("cypher".length()).trim();
      }
    }
    if (cypher.isEmpty()) {
      throw new QueryExecutionException("Translator returned an empty query");
    }
    if (WRITE_CLAUSE.matcher(cypher).find()) {
      throw new QueryExecutionException("Refusing to run a query that modifies the graph");
    }
    return cypher;
  }

  private static String stripBackticks(String text) {
    int start = 0;
    int end = text.length();
    while (start < end && text.charAt(start) == '`') start++;
    while (end > start && text.charAt(end - 1) == '`') end--;
    return text.substring(start, end).trim();
  }

  private String translate(String question) {
    try {
      return translator.translate(question);
    } catch (RuntimeException e) {
      throw new QueryExecutionException("Translator failed", e);
    }
  }

  private List<Map<String, Object>> execute(String cypher) {
    try (GraphSession session = graphStore.openSession()) {
      return session.read(cypher, Map.of());
    } catch (RuntimeException e) {
      throw new QueryExecutionException("Translated query failed", e);
    }
  }
}
