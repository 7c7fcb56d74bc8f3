package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.capacity.CapacityCalculator;
import com.standcapacity.engine.capacity.CapacityResult;
import com.standcapacity.engine.capacity.SlotCapacity;
import com.standcapacity.engine.capacity.StandAvailability;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.slot.TimeSlotGrid;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quantifies how maintenance erodes capacity: for every day of a range the capacity is computed
 * once without and once with the downtime overlay, and the two are diffed.
 *
 * <p>Purely analytical; it reads maintenance requests and never touches allocations.
 */
public class MaintenanceImpactIntegrator {
  private static final Logger log = LoggerFactory.getLogger(MaintenanceImpactIntegrator.class);

  private final ReferenceSnapshot snapshot;
  private final CapacityCalculator calculator;

  public MaintenanceImpactIntegrator(ReferenceSnapshot snapshot) {
    this(snapshot, new CapacityCalculator(snapshot));
  }

  public MaintenanceImpactIntegrator(ReferenceSnapshot snapshot, CapacityCalculator calculator) {
    this.snapshot = snapshot;
    this.calculator = calculator;
  }

  public MaintenanceImpact integrate(DateRange range, Collection<MaintenanceRequest> requests) {
    return integrate(range, requests, List.of(), ImpactOptions.DEFAULT, new RunControl());
  }

  /**
   * Computes the capacity delta over a date range.
   *
   * @param range days to analyse
   * @param requests one-off requests, any status
   * @param schedules recurring schedules expanded over the range
   * @param options pivot mode and potential-impact switch
   * @param control cancellation and progress; checked at slot boundaries
   * @return impact, incomplete when cancelled
   * @throws com.standcapacity.engine.error.DataException when a request names an unknown stand
   */
  public MaintenanceImpact integrate(
      DateRange range,
      Collection<MaintenanceRequest> requests,
      Collection<RecurringMaintenanceSchedule> schedules,
      ImpactOptions options,
      RunControl control) {
    List<MaintenanceRequest> all = new ArrayList<>(requests);
    // a window crossing midnight may start the day before the range
    DateRange expansion = new DateRange(range.from().minusDays(1), range.to());
    for (RecurringMaintenanceSchedule schedule : schedules) {
      all.addAll(schedule.expand(expansion, snapshot.settings().utcOffset()));
    }
    for (MaintenanceRequest request : all) {
      snapshot.requireStand(request.standId());
    }

    List<DailyImpact> perDay = new ArrayList<>();
    Map<String, MaintenanceRequest> affected = new LinkedHashMap<>();
    Map<String, Double> lost = new LinkedHashMap<>();
    snapshot.sizeCategoryCodes().forEach(category -> lost.put(category, 0.0));
    boolean complete = true;

    for (LocalDate day : range.days()) {
      if (control.isCancelled()) {
        complete = false;
        break;
      }
      TimeSlotGrid grid = TimeSlotGrid.build(day, snapshot.settings());
      collectAffected(grid, all, options.includePotential(), affected);

      CapacityResult baseline =
          calculator.calculate(grid, options.mode(), StandAvailability.ALWAYS, control);
      MaintenanceCalendar definite = MaintenanceCalendar.approved(grid, all, snapshot);
      CapacityResult impacted = calculator.calculate(grid, options.mode(), definite, control);
      if (!baseline.complete() || !impacted.complete()) {
        complete = false;
        break;
      }

      Map<String, Double> potentialDelta = Map.of();
      if (options.includePotential()) {
        MaintenanceCalendar pending = MaintenanceCalendar.forDay(grid, all, snapshot,
            status -> status.affectsCapacity() || status == MaintenanceStatus.REQUESTED);
        CapacityResult potential = calculator.calculate(grid, options.mode(), pending, control);
        if (!potential.complete()) {
          complete = false;
          break;
        }
        potentialDelta = categoryDelta(impacted, potential);
      }

      Map<String, Double> delta = categoryDelta(baseline, impacted);
      delta.forEach((category, value) -> lost.merge(category, -value, Double::sum));
      perDay.add(new DailyImpact(
          day, baseline, impacted, delta, slotDeltas(baseline, impacted), potentialDelta));
    }

    List<AffectedStandWindow> windows = affectedWindows(affected);
    log.debug(
        "Maintenance impact {}..{} days={} affectedWindows={} complete={}",
        range.from(),
        range.to(),
        perDay.size(),
        windows.size(),
        complete);
    return new MaintenanceImpact(
        range, List.copyOf(perDay), Collections.unmodifiableMap(lost), windows, complete);
  }

  private void collectAffected(
      TimeSlotGrid grid,
      List<MaintenanceRequest> all,
      boolean includePotential,
      Map<String, MaintenanceRequest> affected) {
    for (MaintenanceRequest request : all) {
      boolean relevant = request.affectsCapacity()
          || (includePotential && request.status() == MaintenanceStatus.REQUESTED);
      if (relevant && MaintenanceCalendar.clip(grid, request, grid.window()) != null) {
        affected.putIfAbsent(request.id(), request);
      }
    }
  }

  private List<AffectedStandWindow> affectedWindows(Map<String, MaintenanceRequest> affected) {
    return affected.values().stream()
        .sorted(Comparator.comparing(MaintenanceRequest::start)
            .thenComparingInt(r -> snapshot.standOrder(r.standId()))
            .thenComparing(MaintenanceRequest::id))
        .map(r -> {
          Stand stand = snapshot.requireStand(r.standId());
          return new AffectedStandWindow(
              r.id(), stand.id(), stand.code(), r.start(), r.end(), r.status(),
              !r.affectsCapacity());
        })
        .toList();
  }

  private static Map<String, Double> categoryDelta(CapacityResult from, CapacityResult to) {
    Map<String, Double> delta = new LinkedHashMap<>();
    for (String category : from.categories()) {
      delta.put(category, to.standHours(category) - from.standHours(category));
    }
    return Collections.unmodifiableMap(delta);
  }

  private static List<SlotDelta> slotDeltas(CapacityResult baseline, CapacityResult impacted) {
    List<SlotDelta> deltas = new ArrayList<>(baseline.bySlot().size());
    for (SlotCapacity before : baseline.bySlot()) {
      SlotCapacity after = impacted.slot(before.slotIndex());
      Map<String, Integer> delta = new LinkedHashMap<>();
      for (String category : baseline.categories()) {
        delta.put(category, after.count(category) - before.count(category));
      }
      deltas.add(new SlotDelta(before.slotIndex(), before.start(), Collections.unmodifiableMap(delta)));
    }
    return List.copyOf(deltas);
  }
}
