package com.gentoro.medigraph.sync.mapping;

import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.plan.NodeRef;
import com.gentoro.medigraph.sync.plan.UpsertPlan;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** {@code Provider {id, name, specialty, state, zip}}; no outgoing references. */
public class ProviderMapping extends AbstractEntityMapping {

  public ProviderMapping() {
    super(EntityType.PROVIDER);
  }

  @Override
  Optional<UpsertPlan> build(SourceRow row, NodeRef self) {
    Map<String, Object> props = new LinkedHashMap<>();
    props.put("name", ValueConverter.asText(row.get("PROVIDER_NAME")));
    props.put("specialty", ValueConverter.asText(row.get("SPECIALTY")));
    props.put("state", ValueConverter.asText(row.get("STATE")));
    props.put("zip", ValueConverter.asText(row.get("ZIP")));
    return Optional.of(new UpsertPlan().upsert(self, props));
  }
}
