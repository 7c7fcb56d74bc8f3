package com.standcapacity.planner.io;

import com.standcapacity.engine.maintenance.MaintenanceRequest;
import com.standcapacity.engine.maintenance.RecurringMaintenanceSchedule;
import java.util.List;

public record MaintenanceInput(
    List<MaintenanceRequest> requests, List<RecurringMaintenanceSchedule> schedules) {
  public static final MaintenanceInput EMPTY = new MaintenanceInput(List.of(), List.of());
}
