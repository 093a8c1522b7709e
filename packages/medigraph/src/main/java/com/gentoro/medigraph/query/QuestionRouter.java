package com.gentoro.medigraph.query;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic question router. The first route in the table whose trigger matches the
 * normalized question wins; no query runs when nothing matches.
 */
public class QuestionRouter {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(QuestionRouter.class);

  private final List<IntentRoute> routes;

  public QuestionRouter() {
    this(IntentRoutes.defaults());
  }

  public QuestionRouter(List<IntentRoute> routes) {
    this.routes = List.copyOf(routes);
  }

  public Optional<IntentRoute> match(String question) {
    if (question == null) return Optional.empty();
    String normalized = question.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) return Optional.empty();
    for (IntentRoute route : routes) {
      if (route.matches(normalized)) {
        return Optional.of(route);
      }
    }
    return Optional.empty();
  }

  /** Resolve the question to a bound query, or empty when no route claims it. */
  public Optional<GraphQuery> route(String question) {
    return match(question)
        .map(
            route -> {
              String parameter = route.extractParameter(question);
              log.debug("Routed '{}' to {} with parameter '{}'", question, route.intent(), parameter);
              return new GraphQuery(
                  route,
                  parameter,
                  route.buildQuery(parameter),
                  Map.of("term", parameter, "limit", (long) route.limit()));
            });
  }

  public List<IntentRoute> routes() {
    return routes;
  }
}
