package com.gentoro.medigraph.sync.mapping;

import com.gentoro.medigraph.model.EntityType;
import com.gentoro.medigraph.model.SourceRow;
import com.gentoro.medigraph.sync.plan.NodeRef;
import com.gentoro.medigraph.sync.plan.UpsertPlan;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/** {@code Patient {id, first_name, last_name, full_name, sex, zip, age}}. */
public class PatientMapping extends AbstractEntityMapping {

  public PatientMapping() {
    super(EntityType.PATIENT);
  }

  @Override
  Optional<UpsertPlan> build(SourceRow row, NodeRef self) {
    String first = ValueConverter.asText(row.get("FIRST_NAME"));
    String last = ValueConverter.asText(row.get("LAST_NAME"));

    Map<String, Object> props = new LinkedHashMap<>();
    props.put("first_name", first);
    props.put("last_name", last);
    props.put("full_name", fullName(first, last));
    props.put("sex", ValueConverter.asText(row.get("SEX")));
    // Leading zeros matter ("02115")
    props.put("zip", ValueConverter.asText(row.get("ZIP")));
    props.put("age", ValueConverter.asInteger(row.get("AGE")));
    return Optional.of(new UpsertPlan().upsert(self, props));
  }

  static String fullName(String first, String last) {
    StringJoiner joiner = new StringJoiner(" ");
    if (first != null) joiner.add(first);
    if (last != null) joiner.add(last);
    String name = joiner.toString();
    return name.isEmpty() ? null : name;
  }
}
