package com.gentoro.medigraph.query;

import com.gentoro.medigraph.exception.ExceptionUtil;
import com.gentoro.medigraph.exception.QueryExecutionException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.graph.GraphStore;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers free-text questions against the graph. Each question gets its own session. Read
 * failures are absorbed into a soft message; they never reach the caller as exceptions.
 */
public class QuestionAnsweringService {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(QuestionAnsweringService.class);

  public static final String SOFT_FAILURE_MESSAGE = "I couldn't retrieve data for this question.";

  public static final String HELP_TEXT =
      "Right now I support questions like:\n"
          + "- show patients with diabetes\n"
          + "- show patients with hypertension\n"
          + "- show medications for diabetes\n"
          + "- show medications for patient P001\n"
          + "- show providers for patient P001\n"
          + "- show observations for patient P001\n"
          + "- show encounters for patient P001";

  private final GraphStore graphStore;
  private final QuestionRouter router;

  public QuestionAnsweringService(GraphStore graphStore, QuestionRouter router) {
    this.graphStore = Objects.requireNonNull(graphStore, "graphStore");
    this.router = Objects.requireNonNull(router, "router");
  }

  public QueryAnswer answer(String question) {
    Optional<GraphQuery> routed = router.route(question);
    if (routed.isEmpty()) {
      log.debug("No route for question '{}'", question);
      return QueryAnswer.messageOnly(HELP_TEXT, null);
    }
    GraphQuery query = routed.get();

    List<Map<String, Object>> records;
    try {
      records = execute(query);
    } catch (QueryExecutionException e) {
      log.warn("Question '{}' failed: {}", question, ExceptionUtil.describe(e));
      return QueryAnswer.messageOnly(SOFT_FAILURE_MESSAGE, query.intent());
    }

    ResultTable table = ResultProjector.project(records, query.columns());
    if (table.isEmpty()) {
      return QueryAnswer.messageOnly(query.route().notFoundMessage(query.parameter()), query.intent());
    }
    return QueryAnswer.withTable(
        query.route().successMessage(query.parameter()), query.intent(), table);
  }

  private List<Map<String, Object>> execute(GraphQuery query) {
    try (GraphSession session = graphStore.openSession()) {
      return session.read(query.cypher(), query.params());
    } catch (RuntimeException e) {
      throw new QueryExecutionException("Query for " + query.intent() + " failed", e);
    }
  }
}
