package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/**
 * Restricts an airline to the terminals it has allocations for. When an airline has at least
 * one allocation, its flights are only eligible on stands of those terminals.
 *
 * @param airlineCode IATA airline code
 * @param terminalCode allowed terminal
 * @param requiresContactStand whether the airline's flights need a jet-bridge stand
 */
public record AirlineTerminalAllocation(
    String airlineCode, String terminalCode, boolean requiresContactStand) {
  public AirlineTerminalAllocation {
    if (airlineCode == null || airlineCode.isBlank() || terminalCode == null) {
      throw new ConfigException("airline terminal allocation requires an airline and a terminal");
    }
  }
}
