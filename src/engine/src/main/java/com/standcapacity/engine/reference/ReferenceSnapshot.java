package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.error.DataException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable, validated reference data for one planning run.
 *
 * <p>Instances are built through {@link #builder()}; {@link Builder#build()} enforces every
 * cross-entity invariant, so engine components can rely on references being resolvable. A
 * snapshot holds no mutable state and may be shared by concurrent runs.
 *
 * <p>Iteration orders are fixed: size categories by code, aircraft types by code, stands by
 * {@code (pier.code, stand.code)}.
 */
public final class ReferenceSnapshot {
  private final OperationalSettings settings;
  private final List<SizeCategory> sizeCategories;
  private final Map<String, Integer> sizeRanks;
  private final Map<String, SizeCategory> sizeCategoriesByCode;
  private final List<AircraftType> aircraftTypes;
  private final Map<String, AircraftType> aircraftTypesByCode;
  private final List<Terminal> terminals;
  private final Map<String, Pier> piersById;
  private final List<Pier> piers;
  private final List<Stand> stands;
  private final Map<String, Stand> standsById;
  private final Map<String, Integer> standOrder;
  private final Map<String, StandAircraftConstraint> constraints;
  private final List<StandAdjacency> adjacencies;
  private final Map<String, Integer> turnaroundMinutes;
  private final Map<String, List<AirlineTerminalAllocation>> airlineAllocations;

  private ReferenceSnapshot(Builder builder) {
    this.settings = builder.settings;

    List<SizeCategory> categories = new ArrayList<>(builder.sizeCategories);
    categories.sort(Comparator.comparing(SizeCategory::code));
    this.sizeCategories = List.copyOf(categories);
    Map<String, Integer> ranks = new HashMap<>();
    Map<String, SizeCategory> categoriesByCode = new HashMap<>();
    for (int i = 0; i < categories.size(); i++) {
      ranks.put(categories.get(i).code(), i);
      categoriesByCode.put(categories.get(i).code(), categories.get(i));
    }
    this.sizeRanks = Map.copyOf(ranks);
    this.sizeCategoriesByCode = Map.copyOf(categoriesByCode);

    List<AircraftType> types = new ArrayList<>(builder.aircraftTypes);
    types.sort(Comparator.comparing(AircraftType::code));
    this.aircraftTypes = List.copyOf(types);
    Map<String, AircraftType> typesByCode = new HashMap<>();
    types.forEach(type -> typesByCode.put(type.code(), type));
    this.aircraftTypesByCode = Map.copyOf(typesByCode);

    List<Terminal> sortedTerminals = new ArrayList<>(builder.terminals);
    sortedTerminals.sort(Comparator.comparing(Terminal::code));
    this.terminals = List.copyOf(sortedTerminals);

    Map<String, Pier> pierMap = new HashMap<>();
    builder.piers.forEach(pier -> pierMap.put(pier.id(), pier));
    this.piersById = Map.copyOf(pierMap);
    List<Pier> sortedPiers = new ArrayList<>(builder.piers);
    sortedPiers.sort(Comparator.comparing(Pier::code).thenComparing(Pier::id));
    this.piers = List.copyOf(sortedPiers);

    List<Stand> sortedStands = new ArrayList<>(builder.stands);
    sortedStands.sort(
        Comparator.comparing((Stand stand) -> pierMap.get(stand.pierId()).code())
            .thenComparing(Stand::code)
            .thenComparing(Stand::id));
    this.stands = List.copyOf(sortedStands);
    Map<String, Stand> standMap = new HashMap<>();
    Map<String, Integer> order = new HashMap<>();
    for (int i = 0; i < sortedStands.size(); i++) {
      standMap.put(sortedStands.get(i).id(), sortedStands.get(i));
      order.put(sortedStands.get(i).id(), i);
    }
    this.standsById = Map.copyOf(standMap);
    this.standOrder = Map.copyOf(order);

    Map<String, StandAircraftConstraint> constraintMap = new HashMap<>();
    builder.constraints.forEach(
        c -> constraintMap.put(constraintKey(c.standId(), c.aircraftTypeCode()), c));
    this.constraints = Map.copyOf(constraintMap);

    this.adjacencies = List.copyOf(builder.adjacencies);

    Map<String, Integer> turnarounds = new HashMap<>();
    builder.turnaroundRules.forEach(
        rule -> turnarounds.put(rule.aircraftTypeCode(), rule.minimumMinutes()));
    this.turnaroundMinutes = Map.copyOf(turnarounds);

    Map<String, List<AirlineTerminalAllocation>> allocations = new LinkedHashMap<>();
    builder.airlineAllocations.forEach(
        a -> allocations.computeIfAbsent(a.airlineCode(), key -> new ArrayList<>()).add(a));
    Map<String, List<AirlineTerminalAllocation>> frozen = new HashMap<>();
    allocations.forEach((airline, list) -> frozen.put(airline, List.copyOf(list)));
    this.airlineAllocations = Map.copyOf(frozen);
  }

  public static Builder builder() {
    return new Builder();
  }

  public OperationalSettings settings() {
    return settings;
  }

  /**
   * Returns a copy of this snapshot with different operational settings.
   *
   * @param newSettings replacement settings
   * @return validated snapshot sharing every other entity
   */
  public ReferenceSnapshot withSettings(OperationalSettings newSettings) {
    return toBuilder().settings(newSettings).build();
  }

  public List<SizeCategory> sizeCategories() {
    return sizeCategories;
  }

  public List<String> sizeCategoryCodes() {
    return sizeCategories.stream().map(SizeCategory::code).toList();
  }

  public Optional<SizeCategory> sizeCategory(String code) {
    return Optional.ofNullable(sizeCategoriesByCode.get(code));
  }

  /**
   * Returns the position of a size category in the total order (0 for the smallest).
   *
   * @param code size category code
   * @return rank of the category
   * @throws DataException when the category is unknown
   */
  public int sizeRank(String code) {
    Integer rank = sizeRanks.get(code);
    if (rank == null) {
      throw new DataException("unknown size category " + code, code);
    }
    return rank;
  }

  public List<AircraftType> aircraftTypes() {
    return aircraftTypes;
  }

  public Optional<AircraftType> aircraftType(String code) {
    return Optional.ofNullable(aircraftTypesByCode.get(code));
  }

  /**
   * Resolves an aircraft type or fails the run.
   *
   * @param code IATA type code
   * @return resolved type
   * @throws DataException when the type is unknown
   */
  public AircraftType requireAircraftType(String code) {
    AircraftType type = aircraftTypesByCode.get(code);
    if (type == null) {
      throw new DataException("unknown aircraft type " + code, code);
    }
    return type;
  }

  public List<Terminal> terminals() {
    return terminals;
  }

  public List<Pier> piers() {
    return piers;
  }

  public Optional<Pier> pier(String id) {
    return Optional.ofNullable(piersById.get(id));
  }

  /** Returns every stand, active or not, in {@code (pier.code, stand.code)} order. */
  public List<Stand> stands() {
    return stands;
  }

  public List<Stand> activeStands() {
    return stands.stream().filter(Stand::active).toList();
  }

  public Optional<Stand> stand(String id) {
    return Optional.ofNullable(standsById.get(id));
  }

  /**
   * Resolves a stand or fails the run.
   *
   * @param id stand id
   * @return resolved stand
   * @throws DataException when the stand is unknown
   */
  public Stand requireStand(String id) {
    Stand stand = standsById.get(id);
    if (stand == null) {
      throw new DataException("unknown stand " + id, id);
    }
    return stand;
  }

  /** Position of a stand in the deterministic stand order; used as the final tie-break. */
  public int standOrder(String standId) {
    Integer order = standOrder.get(standId);
    if (order == null) {
      throw new DataException("unknown stand " + standId, standId);
    }
    return order;
  }

  public String terminalCodeOf(Stand stand) {
    return piersById.get(stand.pierId()).terminalCode();
  }

  public Optional<StandAircraftConstraint> constraint(String standId, String aircraftTypeCode) {
    return Optional.ofNullable(constraints.get(constraintKey(standId, aircraftTypeCode)));
  }

  public List<StandAdjacency> adjacencies() {
    return adjacencies;
  }

  public OptionalInt turnaroundMinutes(String aircraftTypeCode) {
    Integer minutes = turnaroundMinutes.get(aircraftTypeCode);
    return minutes == null ? OptionalInt.empty() : OptionalInt.of(minutes);
  }

  /**
   * Returns the terminal allocations of an airline, empty when the airline is unrestricted.
   *
   * @param airlineCode IATA airline code
   * @return allocations in declaration order
   */
  public List<AirlineTerminalAllocation> airlineAllocations(String airlineCode) {
    return airlineAllocations.getOrDefault(airlineCode, List.of());
  }

  private Builder toBuilder() {
    Builder builder = new Builder().settings(settings);
    sizeCategories.forEach(builder::sizeCategory);
    aircraftTypes.forEach(builder::aircraftType);
    terminals.forEach(builder::terminal);
    piers.forEach(builder::pier);
    stands.forEach(builder::stand);
    constraints.values().stream()
        .sorted(Comparator.comparing(StandAircraftConstraint::standId)
            .thenComparing(StandAircraftConstraint::aircraftTypeCode))
        .forEach(builder::constraint);
    adjacencies.forEach(builder::adjacency);
    turnaroundMinutes.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> builder.turnaroundRule(new TurnaroundRule(e.getKey(), e.getValue())));
    airlineAllocations.keySet().stream()
        .sorted()
        .forEach(airline -> airlineAllocations.get(airline).forEach(builder::airlineAllocation));
    return builder;
  }

  private static String constraintKey(String standId, String aircraftTypeCode) {
    return standId + '\u0000' + aircraftTypeCode;
  }

  /** Collects reference entities and validates them as a whole. */
  public static final class Builder {
    private OperationalSettings settings;
    private final List<SizeCategory> sizeCategories = new ArrayList<>();
    private final List<AircraftType> aircraftTypes = new ArrayList<>();
    private final List<Terminal> terminals = new ArrayList<>();
    private final List<Pier> piers = new ArrayList<>();
    private final List<Stand> stands = new ArrayList<>();
    private final List<StandAircraftConstraint> constraints = new ArrayList<>();
    private final List<StandAdjacency> adjacencies = new ArrayList<>();
    private final List<TurnaroundRule> turnaroundRules = new ArrayList<>();
    private final List<AirlineTerminalAllocation> airlineAllocations = new ArrayList<>();

    private Builder() {}

    public Builder settings(OperationalSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder sizeCategory(SizeCategory category) {
      sizeCategories.add(category);
      return this;
    }

    public Builder aircraftType(AircraftType type) {
      aircraftTypes.add(type);
      return this;
    }

    public Builder terminal(Terminal terminal) {
      terminals.add(terminal);
      return this;
    }

    public Builder pier(Pier pier) {
      piers.add(pier);
      return this;
    }

    public Builder stand(Stand stand) {
      stands.add(stand);
      return this;
    }

    public Builder constraint(StandAircraftConstraint constraint) {
      constraints.add(constraint);
      return this;
    }

    public Builder adjacency(StandAdjacency adjacency) {
      adjacencies.add(adjacency);
      return this;
    }

    public Builder turnaroundRule(TurnaroundRule rule) {
      turnaroundRules.add(rule);
      return this;
    }

    public Builder airlineAllocation(AirlineTerminalAllocation allocation) {
      airlineAllocations.add(allocation);
      return this;
    }

    /**
     * Validates every cross-entity invariant and freezes the snapshot.
     *
     * @return immutable snapshot
     * @throws ConfigException when a schema invariant is violated
     * @throws DataException when an entity references an unknown entity
     */
    public ReferenceSnapshot build() {
      if (settings == null) {
        throw new ConfigException("operational settings are required");
      }
      settings.validate();
      validateSizeCategories();
      Map<String, Integer> ranks = ranksByCode();
      validateAircraftTypes(ranks);
      validateHierarchy(ranks);
      validateConstraints(ranks);
      validateAdjacencies(ranks);
      validateTurnaroundRules();
      validateAirlineAllocations();
      return new ReferenceSnapshot(this);
    }

    private void validateSizeCategories() {
      List<SizeCategory> sorted = new ArrayList<>(sizeCategories);
      sorted.sort(Comparator.comparing(SizeCategory::code));
      Set<String> seen = new HashSet<>();
      for (SizeCategory category : sorted) {
        if (!seen.add(category.code())) {
          throw new ConfigException("duplicate size category " + category.code());
        }
      }
      for (int i = 0; i < sorted.size(); i++) {
        for (int j = i + 1; j < sorted.size(); j++) {
          SizeCategory a = sorted.get(i);
          SizeCategory b = sorted.get(j);
          if (a.minWingspanM() < b.maxWingspanM() && b.minWingspanM() < a.maxWingspanM()) {
            throw new ConfigException(
                "size categories " + a.code() + " and " + b.code() + " overlap on wingspan");
          }
        }
      }
    }

    private Map<String, Integer> ranksByCode() {
      List<String> codes = new ArrayList<>();
      sizeCategories.forEach(category -> codes.add(category.code()));
      Collections.sort(codes);
      Map<String, Integer> ranks = new HashMap<>();
      for (int i = 0; i < codes.size(); i++) {
        ranks.put(codes.get(i), i);
      }
      return ranks;
    }

    private void validateAircraftTypes(Map<String, Integer> ranks) {
      Set<String> seen = new HashSet<>();
      for (AircraftType type : aircraftTypes) {
        if (!seen.add(type.code())) {
          throw new ConfigException("duplicate aircraft type " + type.code());
        }
        if (!ranks.containsKey(type.sizeCategoryCode())) {
          throw new DataException(
              "aircraft type " + type.code() + " references unknown size category "
                  + type.sizeCategoryCode(),
              type.sizeCategoryCode());
        }
        SizeCategory category = sizeCategories.stream()
            .filter(c -> c.code().equals(type.sizeCategoryCode()))
            .findFirst()
            .orElseThrow();
        if (!category.accepts(type.wingspanM(), type.lengthM())) {
          throw new ConfigException(
              "aircraft type " + type.code() + " dimensions are outside the band of category "
                  + category.code());
        }
      }
    }

    private void validateHierarchy(Map<String, Integer> ranks) {
      Set<String> terminalCodes = new HashSet<>();
      for (Terminal terminal : terminals) {
        if (!terminalCodes.add(terminal.code())) {
          throw new ConfigException("duplicate terminal " + terminal.code());
        }
      }

      Map<String, Pier> pierMap = new HashMap<>();
      Set<String> pierCodes = new HashSet<>();
      for (Pier pier : piers) {
        if (!terminalCodes.contains(pier.terminalCode())) {
          throw new DataException(
              "pier " + pier.id() + " references unknown terminal " + pier.terminalCode(),
              pier.terminalCode());
        }
        if (pierMap.put(pier.id(), pier) != null) {
          throw new ConfigException("duplicate pier id " + pier.id());
        }
        if (!pierCodes.add(pier.terminalCode() + '/' + pier.code())) {
          throw new ConfigException(
              "pier code " + pier.code() + " is not unique in terminal " + pier.terminalCode());
        }
      }

      Set<String> standIds = new HashSet<>();
      Set<String> standCodes = new HashSet<>();
      for (Stand stand : stands) {
        if (!standIds.add(stand.id())) {
          throw new ConfigException("duplicate stand id " + stand.id());
        }
        if (!pierMap.containsKey(stand.pierId())) {
          throw new DataException(
              "stand " + stand.id() + " references unknown pier " + stand.pierId(),
              stand.pierId());
        }
        if (!standCodes.add(stand.pierId() + '/' + stand.code())) {
          throw new ConfigException(
              "stand code " + stand.code() + " is not unique in pier " + stand.pierId());
        }
        if (!ranks.containsKey(stand.maxSizeCategoryCode())) {
          throw new DataException(
              "stand " + stand.id() + " references unknown size category "
                  + stand.maxSizeCategoryCode(),
              stand.maxSizeCategoryCode());
        }
      }
    }

    private void validateConstraints(Map<String, Integer> ranks) {
      Map<String, Stand> standMap = new HashMap<>();
      stands.forEach(stand -> standMap.put(stand.id(), stand));
      Map<String, AircraftType> typeMap = new HashMap<>();
      aircraftTypes.forEach(type -> typeMap.put(type.code(), type));
      Set<String> seen = new HashSet<>();

      for (StandAircraftConstraint constraint : constraints) {
        Stand stand = standMap.get(constraint.standId());
        if (stand == null) {
          throw new DataException(
              "constraint references unknown stand " + constraint.standId(),
              constraint.standId());
        }
        AircraftType type = typeMap.get(constraint.aircraftTypeCode());
        if (type == null) {
          throw new DataException(
              "constraint references unknown aircraft type " + constraint.aircraftTypeCode(),
              constraint.aircraftTypeCode());
        }
        if (!seen.add(constraintKey(constraint.standId(), constraint.aircraftTypeCode()))) {
          throw new ConfigException(
              "duplicate constraint for stand " + stand.id() + " and type " + type.code());
        }
        if (constraint.allowed()
            && ranks.get(type.sizeCategoryCode()) > ranks.get(stand.maxSizeCategoryCode())) {
          throw new ConfigException(
              "stand " + stand.id() + " allows " + type.code()
                  + " which exceeds its maximum size category " + stand.maxSizeCategoryCode());
        }
      }
    }

    private void validateAdjacencies(Map<String, Integer> ranks) {
      Set<String> standIds = new HashSet<>();
      stands.forEach(stand -> standIds.add(stand.id()));
      Set<String> typeCodes = new HashSet<>();
      aircraftTypes.forEach(type -> typeCodes.add(type.code()));

      for (StandAdjacency adjacency : adjacencies) {
        requireKnown(standIds, adjacency.standId(), "stand");
        requireKnown(standIds, adjacency.adjacentStandId(), "stand");
        if (adjacency.triggerSizeCode() != null) {
          requireKnown(ranks.keySet(), adjacency.triggerSizeCode(), "size category");
        }
        if (adjacency.maxSizeWhenAdjacentCode() != null) {
          requireKnown(ranks.keySet(), adjacency.maxSizeWhenAdjacentCode(), "size category");
        }
        if (adjacency.prohibitedAircraftTypeCode() != null) {
          requireKnown(typeCodes, adjacency.prohibitedAircraftTypeCode(), "aircraft type");
        }
      }
    }

    private void validateTurnaroundRules() {
      Set<String> typeCodes = new HashSet<>();
      aircraftTypes.forEach(type -> typeCodes.add(type.code()));
      Set<String> seen = new HashSet<>();
      for (TurnaroundRule rule : turnaroundRules) {
        requireKnown(typeCodes, rule.aircraftTypeCode(), "aircraft type");
        if (!seen.add(rule.aircraftTypeCode())) {
          throw new ConfigException("duplicate turnaround rule for " + rule.aircraftTypeCode());
        }
      }
    }

    private void validateAirlineAllocations() {
      Set<String> terminalCodes = new HashSet<>();
      terminals.forEach(terminal -> terminalCodes.add(terminal.code()));
      for (AirlineTerminalAllocation allocation : airlineAllocations) {
        requireKnown(terminalCodes, allocation.terminalCode(), "terminal");
      }
    }

    private static void requireKnown(Set<String> known, String id, String entity) {
      if (!known.contains(id)) {
        throw new DataException("unknown " + entity + " " + id, id);
      }
    }
  }
}
