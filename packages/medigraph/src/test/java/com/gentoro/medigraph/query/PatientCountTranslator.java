package com.gentoro.medigraph.query;

/** Fixed translation, registered for tests through {@code META-INF/services}. */
public class PatientCountTranslator implements QueryTranslator {

  @Override
  public String translate(String question) {
    return "```cypher\nMATCH (p:Patient) RETURN count(p) AS patients\n```";
  }
}
