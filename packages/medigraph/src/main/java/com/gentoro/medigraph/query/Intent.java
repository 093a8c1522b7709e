package com.gentoro.medigraph.query;

/** Question categories the router recognizes. Each maps to exactly one query shape. */
public enum Intent {
  MEDICATIONS_BY_PATIENT,
  PROVIDER_BY_PATIENT,
  OBSERVATIONS_BY_PATIENT,
  ENCOUNTERS_BY_PATIENT,
  MEDICATIONS_BY_CONDITION,
  PATIENTS_BY_CONDITION
}
