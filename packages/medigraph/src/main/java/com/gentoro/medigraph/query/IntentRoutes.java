package com.gentoro.medigraph.query;

import java.util.List;

/**
 * The built-in route table, in priority order. Patient-scoped routes come first because their
 * triggers contain the more general condition-scoped ones ("medications for patient" vs.
 * "medications for").
 */
public final class IntentRoutes {

  public static final String DEFAULT_CONDITION_TERM = "diabetes";

  private static final String[] COMMAND_WORDS = {"show", "list"};

  private IntentRoutes() {}

  public static List<IntentRoute> defaults() {
    return defaults(DEFAULT_CONDITION_TERM);
  }

  public static List<IntentRoute> defaults(String defaultConditionTerm) {
    return List.of(
        IntentRoute.builder(Intent.MEDICATIONS_BY_PATIENT)
            .trigger("medications for patient", "medication for patient")
            .filler(COMMAND_WORDS)
            .query(
                term ->
                    "MATCH (p:Patient)-[:TAKES_MEDICATION]->(m:Medication)\n"
                        + "WHERE "
                        + patientFilter(term)
                        + "\n"
                        + "RETURN DISTINCT p.id AS patient_id, p.full_name AS full_name,"
                        + " m.code AS rxnorm, m.name AS medication\n"
                        + "ORDER BY patient_id, rxnorm\n"
                        + "LIMIT $limit")
            .columns("patient_id", "full_name", "rxnorm", "medication")
            .limit(50)
            .messages("Medications for patient {}:", "I couldn't find medications for patient {}.")
            .build(),
        IntentRoute.builder(Intent.PROVIDER_BY_PATIENT)
            .trigger("providers for patient", "provider for patient")
            .filler(COMMAND_WORDS)
            .query(
                term ->
                    "MATCH (p:Patient)-[:HAS_PROVIDER]->(pr:Provider)\n"
                        + "WHERE "
                        + patientFilter(term)
                        + "\n"
                        + "RETURN DISTINCT p.id AS patient_id, p.full_name AS full_name,"
                        + " pr.id AS provider_id, pr.name AS provider_name,"
                        + " pr.specialty AS specialty, pr.state AS state\n"
                        + "ORDER BY patient_id, provider_id\n"
                        + "LIMIT $limit")
            .columns("patient_id", "full_name", "provider_id", "provider_name", "specialty", "state")
            .limit(50)
            .messages("Providers for patient {}:", "I couldn't find providers for patient {}.")
            .build(),
        IntentRoute.builder(Intent.OBSERVATIONS_BY_PATIENT)
            .trigger("observations for patient", "observation for patient")
            .filler(COMMAND_WORDS)
            .query(
                term ->
                    "MATCH (p:Patient)-[:HAS_OBSERVATION]->(o:Observation)\n"
                        + "WHERE "
                        + patientFilter(term)
                        + "\n"
                        + "RETURN p.id AS patient_id, p.full_name AS full_name,"
                        + " o.id AS observation_id, o.description AS description,"
                        + " o.value AS value, o.unit AS unit, o.category AS category,"
                        + " o.obs_datetime AS obs_datetime\n"
                        + "ORDER BY obs_datetime DESC\n"
                        + "LIMIT $limit")
            .columns(
                "patient_id",
                "full_name",
                "observation_id",
                "description",
                "value",
                "unit",
                "category",
                "obs_datetime")
            .limit(100)
            .messages("Observations for patient {}:", "I couldn't find observations for patient {}.")
            .build(),
        IntentRoute.builder(Intent.ENCOUNTERS_BY_PATIENT)
            .trigger("encounters for patient", "encounter for patient")
            .filler(COMMAND_WORDS)
            .query(
                term ->
                    "MATCH (p:Patient)-[:HAS_ENCOUNTER]->(e:Encounter)\n"
                        + "WHERE "
                        + patientFilter(term)
                        + "\n"
                        + "OPTIONAL MATCH (e)-[:HAS_PROVIDER]->(pr:Provider)\n"
                        + "RETURN p.id AS patient_id, p.full_name AS full_name,"
                        + " e.id AS encounter_id, e.start_time AS start_time,"
                        + " e.end_time AS end_time, coalesce(pr.id, e.provider_npi) AS provider_id\n"
                        + "ORDER BY start_time DESC\n"
                        + "LIMIT $limit")
            .columns("patient_id", "full_name", "encounter_id", "start_time", "end_time", "provider_id")
            .limit(100)
            .messages("Encounters for patient {}:", "I couldn't find encounters for patient {}.")
            .build(),
        IntentRoute.builder(Intent.MEDICATIONS_BY_CONDITION)
            .trigger("medications for", "medication for")
            .filler(COMMAND_WORDS)
            .filler("patients with", "patients who have")
            .defaultTerm(defaultConditionTerm)
            .query(
                term ->
                    "MATCH (p:Patient)-[:HAS_CONDITION]->(c:Condition),\n"
                        + "      (p)-[:TAKES_MEDICATION]->(m:Medication)\n"
                        + "WHERE toLower(c.name) CONTAINS toLower($term)\n"
                        + "RETURN m.code AS rxnorm, m.name AS medication,"
                        + " count(DISTINCT p) AS patients_on_med\n"
                        + "ORDER BY patients_on_med DESC, rxnorm\n"
                        + "LIMIT $limit")
            .columns("rxnorm", "medication", "patients_on_med")
            .limit(50)
            .messages(
                "Medications used by patients with conditions matching '{}':",
                "I couldn't find medications for conditions matching '{}'.")
            .build(),
        IntentRoute.builder(Intent.PATIENTS_BY_CONDITION)
            .trigger("patients with")
            .leadingTrigger("show patients", "list patients")
            .filler(COMMAND_WORDS)
            .filler("patients", "who have")
            .defaultTerm(defaultConditionTerm)
            .query(
                term ->
                    "MATCH (p:Patient)-[:HAS_CONDITION]->(c:Condition)\n"
                        + "WHERE toLower(c.name) CONTAINS toLower($term)\n"
                        + "RETURN p.id AS patient_id, p.full_name AS full_name,"
                        + " p.sex AS sex, p.age AS age, c.name AS condition\n"
                        + "ORDER BY patient_id, condition\n"
                        + "LIMIT $limit")
            .columns("patient_id", "full_name", "sex", "age", "condition")
            .limit(50)
            .messages(
                "Patients with conditions matching '{}':",
                "I couldn't find patients with conditions matching '{}'.")
            .build());
  }

  /**
   * A parameter with a hyphen is an opaque identifier and must match exactly. Anything else is a
   * partial name match, or an exact id for ids without hyphens such as {@code P001}. A blank
   * parameter only matches exactly, so it never selects every patient.
   */
  static String patientFilter(String term) {
    if (term.isBlank() || term.indexOf('-') >= 0) {
      return "toLower(p.id) = toLower($term)";
    }
    return "(toLower(p.full_name) CONTAINS toLower($term) OR toLower(p.id) = toLower($term))";
  }
}
