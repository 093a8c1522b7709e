package com.gentoro.medigraph.sync.mapping;

import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.RelationshipType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.plan.NodeRef;
import com.gentoro.medigraph.sync.plan.UpsertPlan;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@code Observation {id, description, value, unit, category, code, obs_datetime}}. An observation
 * only makes sense attached to a patient, so rows without one are skipped; the encounter link is
 * optional.
 */
public class ObservationMapping extends AbstractEntityMapping {

  public ObservationMapping() {
    super(EntityType.OBSERVATION);
  }

  @Override
  Optional<UpsertPlan> build(SourceRow row, NodeRef self) {
    NodeRef patient = reference(row, "PATIENT_ID", EntityType.PATIENT);
    if (patient == null) {
      return Optional.empty();
    }

    Map<String, Object> props = new LinkedHashMap<>();
    props.put("description", ValueConverter.asText(row.get("DESCRIPTION")));
    props.put("value", ValueConverter.asDouble(row.get("VALUE")));
    props.put("unit", ValueConverter.asText(row.get("UNIT")));
    props.put("category", ValueConverter.asText(row.get("CATEGORY")));
    props.put("code", ValueConverter.asText(row.get("CODE")));
    props.put("obs_datetime", ValueConverter.asTimestampText(row.get("OBS_DATETIME")));

    UpsertPlan plan = new UpsertPlan().upsert(self, props);
    linkFrom(plan, patient, RelationshipType.HAS_OBSERVATION, self);
    linkFrom(
        plan,
        reference(row, "ENCOUNTER_ID", EntityType.ENCOUNTER),
        RelationshipType.HAS_OBSERVATION,
        self);
    return Optional.of(plan);
  }
}
