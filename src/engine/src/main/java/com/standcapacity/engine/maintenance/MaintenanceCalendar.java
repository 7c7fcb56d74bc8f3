package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.capacity.StandAvailability;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.slot.Interval;
import com.standcapacity.engine.slot.TimeSlotGrid;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Maintenance downtime of one operating day, clipped to the operating window and expressed in
 * grid minutes. A stand is unavailable in every slot its downtime intersects.
 */
public final class MaintenanceCalendar implements StandAvailability {
  private final TimeSlotGrid grid;
  private final Map<String, List<Interval>> downtimeByStand;

  private MaintenanceCalendar(TimeSlotGrid grid, Map<String, List<Interval>> downtimeByStand) {
    this.grid = grid;
    this.downtimeByStand = downtimeByStand;
  }

  public static MaintenanceCalendar empty(TimeSlotGrid grid) {
    return new MaintenanceCalendar(grid, Map.of());
  }

  /**
   * Builds the calendar of a day.
   *
   * @param grid slot grid of the day
   * @param requests maintenance requests, any day
   * @param snapshot reference used to resolve stands
   * @param statusFilter statuses that take a stand out of service
   * @return calendar of the day
   * @throws com.standcapacity.engine.error.DataException when a request names an unknown stand
   */
  public static MaintenanceCalendar forDay(
      TimeSlotGrid grid,
      Collection<MaintenanceRequest> requests,
      ReferenceSnapshot snapshot,
      Predicate<MaintenanceStatus> statusFilter) {
    Map<String, List<Interval>> downtime = new TreeMap<>();
    Interval window = grid.window();
    for (MaintenanceRequest request : requests) {
      snapshot.requireStand(request.standId());
      if (!statusFilter.test(request.status())) {
        continue;
      }
      Interval clipped = clip(grid, request, window);
      if (clipped != null) {
        downtime.computeIfAbsent(request.standId(), k -> new ArrayList<>()).add(clipped);
      }
    }
    downtime.values().forEach(list -> list.sort(Comparator.comparingInt(Interval::start)));
    downtime.replaceAll((standId, list) -> List.copyOf(list));
    return new MaintenanceCalendar(grid, downtime);
  }

  /** Definite downtime: requests in a status that affects capacity. */
  public static MaintenanceCalendar approved(
      TimeSlotGrid grid, Collection<MaintenanceRequest> requests, ReferenceSnapshot snapshot) {
    return forDay(grid, requests, snapshot, MaintenanceStatus::affectsCapacity);
  }

  static Interval clip(TimeSlotGrid grid, MaintenanceRequest request, Interval window) {
    int start = grid.minuteOf(request.start());
    int end = grid.minuteOf(request.end());
    if (end <= start) {
      // sub-minute request
      end = start + 1;
    }
    if (end <= window.start() || start >= window.end()) {
      return null;
    }
    return new Interval(start, end).intersect(window);
  }

  public boolean isEmpty() {
    return downtimeByStand.isEmpty();
  }

  public List<Interval> downtime(String standId) {
    return downtimeByStand.getOrDefault(standId, List.of());
  }

  /** Returns whether any downtime of the stand overlaps {@code occupancy}. */
  public boolean blocks(String standId, Interval occupancy) {
    for (Interval interval : downtime(standId)) {
      if (interval.overlaps(occupancy)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isAvailable(Stand stand, int slotIndex) {
    return !blocks(stand.id(), grid.slot(slotIndex).minutes());
  }
}
