package com.gentoro.medigraph.sync.mapping;

import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.RelationshipType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.plan.NodeRef;
import com.gentoro.medigraph.sync.plan.UpsertPlan;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** One prescription row: {@code Medication {code, name}} keyed by RxNorm code. */
public class MedicationMapping extends AbstractEntityMapping {

  public MedicationMapping() {
    super(EntityType.MEDICATION);
  }

  @Override
  Optional<UpsertPlan> build(SourceRow row, NodeRef self) {
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("name", ValueConverter.asText(row.get("NAME")));

    UpsertPlan plan = new UpsertPlan().upsert(self, props);
    linkFrom(
        plan,
        reference(row, "PATIENT_ID", EntityType.PATIENT),
        RelationshipType.TAKES_MEDICATION,
        self);
    linkFrom(
        plan,
        reference(row, "ENC_ID", EntityType.ENCOUNTER),
        RelationshipType.HAS_MEDICATION,
        self);
    return Optional.of(plan);
  }
}
