package com.gentoro.medigraph.query;

/**
 * Turns a free-text question into a Cypher read query. Implementations are external (for example a
 * hosted language model); their output is untrusted and is checked before it runs.
 *
 * <p>Registered through {@code META-INF/services/com.gentoro.medigraph.query.QueryTranslator} and
 * consulted by the {@code ask} mode when {@code router.translator.enabled} is set.
 */
@FunctionalInterface
public interface QueryTranslator {
  String translate(String question);
}
