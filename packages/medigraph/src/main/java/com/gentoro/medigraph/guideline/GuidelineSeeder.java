package com.gentoro.medigraph.guideline;

import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.graph.GraphSession;
import com.gentoro.medigraph.utility.JacksonUtility;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Seeds {@code Guideline} nodes and links them to existing conditions and medications by keyword
 * matching. Runs separately from the batch load and only ever merges, so it can be repeated.
 */
public class GuidelineSeeder {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(GuidelineSeeder.class);

  public static final String DEFAULT_CATALOG_RESOURCE = "guidelines/guidelines.json";

  private static final String UPSERT_GUIDELINE =
      "MERGE (gl:Guideline {id: $id})\n"
          + "SET gl.title = $title, gl.source = $source, gl.text = $text";

  private static final String MENTIONS_CONDITION =
      "MATCH (gl:Guideline {id: $gid}), (c:Condition)\n"
          + "WHERE toLower(c.name) CONTAINS toLower($term)\n"
          + "MERGE (gl)-[:MENTIONS_CONDITION]->(c)";

  private static final String MENTIONS_MEDICATION =
      "MATCH (gl:Guideline {id: $gid}), (m:Medication)\n"
          + "WHERE toLower(m.name) CONTAINS toLower($term)\n"
          + "MERGE (gl)-[:MENTIONS_MEDICATION]->(m)";

  private static final String RECOMMENDS =
      "MATCH (gl:Guideline {id: $gid}), (c:Condition), (m:Medication)\n"
          + "WHERE toLower(c.name) CONTAINS toLower($condition)\n"
          + "  AND toLower(m.name) CONTAINS toLower($medication)\n"
          + "MERGE (gl)-[:RECOMMENDS {reason: $reason}]->(m)\n"
          + "MERGE (gl)-[:TARGETS_CONDITION]->(c)";

  private static final String CONTRAINDICATED_FOR =
      "MATCH (gl:Guideline {id: $gid}), (c:Condition)\n"
          + "WHERE toLower(c.name) CONTAINS toLower($condition)\n"
          + "MERGE (gl)-[:CONTRAINDICATED_FOR]->(c)";

  private final GuidelineCatalog catalog;

  public GuidelineSeeder(GuidelineCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /** Read a catalogue from a file, or the bundled one when {@code path} is blank. */
  public static GuidelineCatalog loadCatalog(String path) {
    try {
      if (path != null && !path.isBlank()) {
        File file = new File(path);
        if (!file.isFile()) {
          throw new ConfigurationException("Guideline catalogue not found: " + file.getAbsolutePath());
        }
        return JacksonUtility.getJsonMapper().readValue(file, GuidelineCatalog.class);
      }
      try (InputStream in =
          GuidelineSeeder.class.getClassLoader().getResourceAsStream(DEFAULT_CATALOG_RESOURCE)) {
        if (in == null) {
          throw new ConfigurationException("Classpath resource not found: " + DEFAULT_CATALOG_RESOURCE);
        }
        return JacksonUtility.getJsonMapper().readValue(in, GuidelineCatalog.class);
      }
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read guideline catalogue: " + e.getMessage(), e);
    }
  }

  /** @return number of guidelines written */
  public int seed(GraphSession session) {
    for (GuidelineCatalog.Guideline g : catalog.guidelines) {
      if (g.id == null || g.id.isBlank()) {
        throw new ConfigurationException("Guideline without id in catalogue");
      }
      session.write(
          UPSERT_GUIDELINE,
          Map.of(
              "id", g.id,
              "title", nullToEmpty(g.title),
              "source", nullToEmpty(g.source),
              "text", nullToEmpty(g.text)));
    }
    log.info("Created/updated {} Guideline nodes", catalog.guidelines.size());

    int links = 0;
    for (GuidelineCatalog.Guideline g : catalog.guidelines) {
      links += link(session, g);
    }
    log.info("Linked guidelines to Condition/Medication nodes ({} link statements)", links);
    return catalog.guidelines.size();
  }

  private int link(GraphSession session, GuidelineCatalog.Guideline g) {
    String text = nullToEmpty(g.text).toLowerCase(Locale.ROOT);
    int statements = 0;

    for (Map.Entry<String, List<String>> e : catalog.conditionKeywords.entrySet()) {
      if (mentionsAny(text, e.getValue())) {
        session.write(MENTIONS_CONDITION, Map.of("gid", g.id, "term", e.getKey()));
        statements++;
      }
    }
    for (Map.Entry<String, List<String>> e : catalog.medicationKeywords.entrySet()) {
      if (mentionsAny(text, e.getValue())) {
        session.write(MENTIONS_MEDICATION, Map.of("gid", g.id, "term", e.getKey()));
        statements++;
      }
    }

    for (GuidelineCatalog.LinkRule rule : catalog.rules) {
      if (rule.kind == null || !mentionsAll(text, rule.requires)) continue;
      switch (rule.kind) {
        case RECOMMENDS -> session.write(
            RECOMMENDS,
            Map.of(
                "gid", g.id,
                "condition", nullToEmpty(rule.condition),
                "medication", nullToEmpty(rule.medication),
                "reason", nullToEmpty(rule.reason)));
        case CONTRAINDICATED_FOR -> session.write(
            CONTRAINDICATED_FOR,
            Map.of("gid", g.id, "condition", nullToEmpty(rule.condition)));
      }
      statements++;
    }
    return statements;
  }

  private static boolean mentionsAny(String text, List<String> phrases) {
    if (phrases == null) return false;
    for (String phrase : phrases) {
      if (text.contains(phrase.toLowerCase(Locale.ROOT))) return true;
    }
    return false;
  }

  private static boolean mentionsAll(String text, List<String> phrases) {
    if (phrases == null || phrases.isEmpty()) return false;
    for (String phrase : phrases) {
      if (!text.contains(phrase.toLowerCase(Locale.ROOT))) return false;
    }
    return true;
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
