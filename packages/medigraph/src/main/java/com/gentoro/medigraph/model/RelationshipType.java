package com.gentoro.medigraph.model;

/** Directed relationship types created by the loader. */
public enum RelationshipType {
  HAS_ENCOUNTER, // Patient -> Encounter
  HAS_PROVIDER, // Patient -> Provider, Encounter -> Provider
  HAS_CONDITION, // Patient -> Condition, Encounter -> Condition
  TAKES_MEDICATION, // Patient -> Medication
  HAS_MEDICATION, // Encounter -> Medication
  HAS_OBSERVATION // Patient -> Observation, Encounter -> Observation
}
