package com.standcapacity.engine.capacity;

import com.standcapacity.engine.reference.AircraftType;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.reference.StandAircraftConstraint;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static stand by aircraft-type eligibility of a reference snapshot.
 *
 * <p>An active stand can host a type when the wingspan and length fit, the type's size category
 * does not exceed the stand's maximum, and no disallowing {@link StandAircraftConstraint} exists.
 * A disallowing constraint always wins over the dimensional inference.
 */
public final class EligibilityMatrix {
  private final ReferenceSnapshot snapshot;
  private final List<Stand> stands;
  private final Map<String, Set<String>> typesByStand;
  private final Map<String, List<Stand>> standsByType;
  private final Map<String, Set<String>> capabilityByStand;

  private EligibilityMatrix(ReferenceSnapshot snapshot) {
    this.snapshot = snapshot;
    this.stands = snapshot.activeStands();
    this.typesByStand = new HashMap<>();
    this.standsByType = new LinkedHashMap<>();
    this.capabilityByStand = new HashMap<>();

    for (AircraftType type : snapshot.aircraftTypes()) {
      standsByType.put(type.code(), new ArrayList<>());
    }
    for (Stand stand : stands) {
      int standRank = snapshot.sizeRank(stand.maxSizeCategoryCode());
      Set<String> types = new LinkedHashSet<>();
      Set<String> categories = new LinkedHashSet<>();
      for (AircraftType type : snapshot.aircraftTypes()) {
        if (fits(stand, standRank, type)) {
          types.add(type.code());
          standsByType.get(type.code()).add(stand);
        }
      }
      // keep capability in category order rather than type order
      for (String category : snapshot.sizeCategoryCodes()) {
        for (String typeCode : types) {
          if (snapshot.requireAircraftType(typeCode).sizeCategoryCode().equals(category)) {
            categories.add(category);
            break;
          }
        }
      }
      typesByStand.put(stand.id(), Set.copyOf(types));
      capabilityByStand.put(stand.id(), categories);
    }
    standsByType.replaceAll((code, list) -> List.copyOf(list));
  }

  /**
   * Builds the matrix for every active stand and known aircraft type.
   *
   * @param snapshot validated reference snapshot
   * @return eligibility matrix
   * @throws com.standcapacity.engine.error.DataException when a stand references an unknown size
   *     category
   */
  public static EligibilityMatrix of(ReferenceSnapshot snapshot) {
    return new EligibilityMatrix(snapshot);
  }

  private boolean fits(Stand stand, int standRank, AircraftType type) {
    if (type.wingspanM() > stand.maxWingspanM() || type.lengthM() > stand.maxLengthM()) {
      return false;
    }
    if (snapshot.sizeRank(type.sizeCategoryCode()) > standRank) {
      return false;
    }
    return snapshot.constraint(stand.id(), type.code())
        .map(StandAircraftConstraint::allowed)
        .orElse(true);
  }

  /** Active stands in {@code (pier.code, stand.code)} order. */
  public List<Stand> stands() {
    return stands;
  }

  public boolean canHost(String standId, String aircraftTypeCode) {
    Set<String> types = typesByStand.get(standId);
    return types != null && types.contains(aircraftTypeCode);
  }

  /**
   * Stands able to host a type, in stand order. Empty for an unknown type.
   *
   * @param aircraftTypeCode IATA type code
   * @return eligible active stands
   */
  public List<Stand> standsFor(String aircraftTypeCode) {
    return standsByType.getOrDefault(aircraftTypeCode, List.of());
  }

  /** Aircraft types the stand can host; empty for an inactive or unknown stand. */
  public Set<String> typesAt(String standId) {
    return typesByStand.getOrDefault(standId, Set.of());
  }

  /** Size categories for which the stand can host at least one type, in category order. */
  public Set<String> capability(String standId) {
    return capabilityByStand.getOrDefault(standId, Set.of());
  }

  /** Aircraft types hostable by at least one active stand. */
  public List<String> hostableTypes() {
    return standsByType.entrySet().stream()
        .filter(e -> !e.getValue().isEmpty())
        .map(Map.Entry::getKey)
        .toList();
  }
}
