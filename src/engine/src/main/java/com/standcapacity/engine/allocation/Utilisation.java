package com.standcapacity.engine.allocation;

import java.util.List;

public record Utilisation(List<StandUtilisation> perStand, List<SlotUtilisation> perSlot) {
  /** Utilisation of a stand, or {@code null} when the stand is not active. */
  public StandUtilisation stand(String standId) {
    return perStand.stream().filter(u -> u.standId().equals(standId)).findFirst().orElse(null);
  }
}
