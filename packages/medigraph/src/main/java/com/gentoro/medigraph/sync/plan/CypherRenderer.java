package com.gentoro.medigraph.sync.plan;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders an {@link UpsertPlan} into a single parameterized Cypher statement. Labels, key
 * properties and relationship types come from the fixed entity catalogue and are inlined; every
 * value travels as a parameter.
 */
public final class CypherRenderer {

  private CypherRenderer() {}

  /** Cypher text plus its parameters. */
  public record Statement(String cypher, Map<String, Object> params) {}

  public static Statement render(UpsertPlan plan) {
    StringBuilder cypher = new StringBuilder();
    Map<String, Object> params = new LinkedHashMap<>();
    Map<NodeRef, String> variables = new HashMap<>();

    for (PlanOperation op : plan.operations()) {
      if (op instanceof NodeUpsert upsert) {
        String var = bind(upsert.node(), variables, cypher, params);
        String propsParam = var + "_props";
        cypher.append("SET ").append(var).append(" += $").append(propsParam).append('\n');
        params.put(propsParam, new LinkedHashMap<>(upsert.properties()));
      } else if (op instanceof StubMerge stub) {
        bind(stub.node(), variables, cypher, params);
      } else if (op instanceof EdgeMerge edge) {
        cypher
            .append("MERGE (")
            .append(variables.get(edge.from()))
            .append(")-[:")
            .append(edge.type().name())
            .append("]->(")
            .append(variables.get(edge.to()))
            .append(")\n");
      } else {
        throw new IllegalArgumentException("Unsupported plan operation: " + op);
      }
    }
    return new Statement(cypher.toString().trim(), params);
  }

  /** Emit a MERGE for the node the first time it is seen; return its variable. */
  private static String bind(
      NodeRef node, Map<NodeRef, String> variables, StringBuilder cypher, Map<String, Object> params) {
    String existing = variables.get(node);
    if (existing != null) return existing;
    String var = "n" + variables.size();
    variables.put(node, var);
    String keyParam = var + "_key";
    cypher
        .append("MERGE (")
        .append(var)
        .append(':')
        .append(node.label())
        .append(" {")
        .append(node.keyProperty())
        .append(": $")
        .append(keyParam)
        .append("})\n");
    params.put(keyParam, node.key());
    return var;
  }
}
