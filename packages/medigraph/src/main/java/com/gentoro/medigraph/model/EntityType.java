package com.gentoro.medigraph.model;

import java.util.List;

/**
 * Entity types synchronized from the warehouse into the graph. Each constant carries both sides of
 * the mapping: the graph label and natural-key property, and the source view with its column set.
 */
public enum EntityType {
  PROVIDER(
      "Provider",
      "id",
      "provider",
      "MEDIGRAPH.PUBLIC.V_PROVIDERS",
      "PROVIDER_ID",
      List.of("PROVIDER_ID", "PROVIDER_NAME", "SPECIALTY", "STATE", "ZIP"),
      null),
  PATIENT(
      "Patient",
      "id",
      "patient",
      "MEDIGRAPH.PUBLIC.V_PATIENTS",
      "PATIENT_ID",
      List.of("PATIENT_ID", "FIRST_NAME", "LAST_NAME", "SEX", "ZIP", "AGE"),
      null),
  ENCOUNTER(
      "Encounter",
      "id",
      "encounter",
      "MEDIGRAPH.PUBLIC.V_ENCOUNTERS",
      "ENC_ID",
      List.of("ENC_ID", "PATIENT_ID", "PROVIDER_NPI", "START_TIME", "END_TIME"),
      null),
  CONDITION(
      "Condition",
      "code",
      "condition",
      "MEDIGRAPH.PUBLIC.V_CONDITIONS",
      "ICD_CODE",
      List.of("ENC_ID", "PATIENT_ID", "ICD_CODE", "NAME"),
      null),
  MEDICATION(
      "Medication",
      "code",
      "medication",
      "MEDIGRAPH.PUBLIC.V_MEDICATIONS",
      "RXNORM",
      List.of("ENC_ID", "PATIENT_ID", "RXNORM", "NAME"),
      null),
  OBSERVATION(
      "Observation",
      "id",
      "observation",
      "MEDIGRAPH.PUBLIC.OBSERVATIONS",
      "OBSERVATION_ID",
      List.of(
          "OBSERVATION_ID",
          "PATIENT_ID",
          "ENCOUNTER_ID",
          "DESCRIPTION",
          "VALUE",
          "UNIT",
          "CATEGORY",
          "CODE",
          "OBS_DATETIME"),
      "OBS_DATETIME");

  /**
   * Dependency order for a full load: providers and patients first, then encounters that reference
   * them, then the clinical facts hanging off encounters.
   */
  public static final List<EntityType> LOAD_ORDER =
      List.of(PROVIDER, PATIENT, ENCOUNTER, CONDITION, MEDICATION, OBSERVATION);

  private final String label;
  private final String keyProperty;
  private final String configKey;
  private final String defaultSource;
  private final String keyColumn;
  private final List<String> sourceColumns;
  private final String orderByColumn; // nullable

  EntityType(
      String label,
      String keyProperty,
      String configKey,
      String defaultSource,
      String keyColumn,
      List<String> sourceColumns,
      String orderByColumn) {
    this.label = label;
    this.keyProperty = keyProperty;
    this.configKey = configKey;
    this.defaultSource = defaultSource;
    this.keyColumn = keyColumn;
    this.sourceColumns = sourceColumns;
    this.orderByColumn = orderByColumn;
  }

  /** Graph node label. */
  public String label() {
    return label;
  }

  /** Graph property holding the natural key. */
  public String keyProperty() {
    return keyProperty;
  }

  /** Suffix used for per-entity configuration keys, e.g. {@code source.views.patient}. */
  public String configKey() {
    return configKey;
  }

  public String defaultSource() {
    return defaultSource;
  }

  /** Source column holding this entity's own natural key. */
  public String keyColumn() {
    return keyColumn;
  }

  public List<String> sourceColumns() {
    return sourceColumns;
  }

  /** Column the extract must be ordered by, or null when no ordering is required. */
  public String orderByColumn() {
    return orderByColumn;
  }

  /** Plural used in progress messages ("Patients loaded: 500/7000"). */
  public String pluralName() {
    return label + "s";
  }
}
