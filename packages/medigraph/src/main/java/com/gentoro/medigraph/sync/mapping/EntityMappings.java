package com.gentoro.medigraph.sync.mapping;

import com.gentoro.medigraph.model.EntityType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Registry of the mapping used for each entity type. */
public final class EntityMappings {
  private final Map<EntityType, EntityMapping> mappings;

  private EntityMappings(Map<EntityType, EntityMapping> mappings) {
    this.mappings = Collections.unmodifiableMap(mappings);
  }

  public static EntityMappings defaults() {
    return of(
        List.of(
            new ProviderMapping(),
            new PatientMapping(),
            new EncounterMapping(),
            new ConditionMapping(),
            new MedicationMapping(),
            new ObservationMapping()));
  }

  /** Every entity type must be covered exactly once. */
  public static EntityMappings of(List<? extends EntityMapping> list) {
    Map<EntityType, EntityMapping> map = new EnumMap<>(EntityType.class);
    for (EntityMapping mapping : list) {
      if (map.put(mapping.entityType(), mapping) != null) {
        throw new IllegalArgumentException("Duplicate mapping for " + mapping.entityType());
      }
    }
    for (EntityType type : EntityType.values()) {
      if (!map.containsKey(type)) {
        throw new IllegalArgumentException("No mapping registered for " + type);
      }
    }
    return new EntityMappings(map);
  }

  public EntityMapping forType(EntityType type) {
    return mappings.get(type);
  }
}
