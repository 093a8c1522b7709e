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
 * {@code Encounter {id, start_time, end_time, provider_npi}} linked from its patient and to its
 * provider. The patient is also linked to the provider directly, which is what the
 * provider-by-patient question reads.
 */
public class EncounterMapping extends AbstractEntityMapping {

  public EncounterMapping() {
    super(EntityType.ENCOUNTER);
  }

  @Override
  Optional<UpsertPlan> build(SourceRow row, NodeRef self) {
    NodeRef patient = reference(row, "PATIENT_ID", EntityType.PATIENT);
    NodeRef provider = reference(row, "PROVIDER_NPI", EntityType.PROVIDER);

    Map<String, Object> props = new LinkedHashMap<>();
    props.put("start_time", ValueConverter.asTimestampText(row.get("START_TIME")));
    props.put("end_time", ValueConverter.asTimestampText(row.get("END_TIME")));
    props.put("provider_npi", provider == null ? null : provider.key());

    UpsertPlan plan = new UpsertPlan().upsert(self, props);
    linkFrom(plan, patient, RelationshipType.HAS_ENCOUNTER, self);
    linkTo(plan, self, RelationshipType.HAS_PROVIDER, provider);
    if (patient != null && provider != null) {
      plan.edge(patient, RelationshipType.HAS_PROVIDER, provider);
    }
    return Optional.of(plan);
  }
}
