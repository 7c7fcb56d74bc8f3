package com.standcapacity.engine.run;

import com.standcapacity.engine.allocation.AllocationOptions;
import com.standcapacity.engine.capacity.CapacityMode;
import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.flight.Flight;
import com.standcapacity.engine.maintenance.DateRange;
import com.standcapacity.engine.maintenance.MaintenanceRequest;
import com.standcapacity.engine.maintenance.RecurringMaintenanceSchedule;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import java.time.LocalDate;
import java.util.List;

/**
 * Inputs of a full pipeline run: capacity baseline, allocation and maintenance impact.
 *
 * @param snapshot reference data
 * @param day operating day of the capacity and allocation stages
 * @param flights flights of {@code day}
 * @param maintenance one-off maintenance requests
 * @param schedules recurring maintenance
 * @param impactRange days of the impact stage, defaults to {@code day}
 * @param mode capacity pivot axis
 * @param allocationOptions allocator switches
 * @param includePotentialImpact report the impact of requests awaiting approval
 */
public record PlanningRequest(
    ReferenceSnapshot snapshot,
    LocalDate day,
    List<Flight> flights,
    List<MaintenanceRequest> maintenance,
    List<RecurringMaintenanceSchedule> schedules,
    DateRange impactRange,
    CapacityMode mode,
    AllocationOptions allocationOptions,
    boolean includePotentialImpact) {

  public PlanningRequest {
    if (snapshot == null || day == null) {
      throw new ConfigException("a planning request needs reference data and a day");
    }
    flights = flights == null ? List.of() : List.copyOf(flights);
    maintenance = maintenance == null ? List.of() : List.copyOf(maintenance);
    schedules = schedules == null ? List.of() : List.copyOf(schedules);
    if (impactRange == null) {
      impactRange = DateRange.of(day);
    }
    if (mode == null) {
      mode = CapacityMode.BY_TIME_SLOT;
    }
    if (allocationOptions == null) {
      allocationOptions = AllocationOptions.DEFAULT;
    }
  }
}
