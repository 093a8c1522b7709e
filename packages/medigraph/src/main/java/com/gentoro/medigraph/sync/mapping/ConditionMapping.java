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
 * One diagnosis row: {@code Condition {code, name}} plus the patient and encounter that recorded
 * it. The same code shows up once per diagnosis, so the node is shared.
 */
public class ConditionMapping extends AbstractEntityMapping {

  public ConditionMapping() {
    super(EntityType.CONDITION);
  }

  @Override
  Optional<UpsertPlan> build(SourceRow row, NodeRef self) {
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("name", ValueConverter.asText(row.get("NAME")));

    UpsertPlan plan = new UpsertPlan().upsert(self, props);
    linkFrom(
        plan,
        reference(row, "PATIENT_ID", EntityType.PATIENT),
        RelationshipType.HAS_CONDITION,
        self);
    linkFrom(
        plan,
        reference(row, "ENC_ID", EntityType.ENCOUNTER),
        RelationshipType.HAS_CONDITION,
        self);
    return Optional.of(plan);
  }
}
