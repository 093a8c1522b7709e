package com.gentoro.medigraph.query;

import java.util.List;
import java.util.Map;

/** A routed question ready to execute: the chosen route, its parameter and the bound query. */
public record GraphQuery(
    IntentRoute route, String parameter, String cypher, Map<String, Object> params) {

  public Intent intent() {
    return route.intent();
  }

  public List<String> columns() {
    return route.columns();
  }
}
