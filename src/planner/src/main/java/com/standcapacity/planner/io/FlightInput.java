package com.standcapacity.planner.io;

import com.standcapacity.engine.flight.Flight;
import java.time.LocalDate;
import java.util.List;

/**
 * Flights read from a flight document.
 *
 * @param day operating day named by the document, or {@code null} when absent
 * @param flights flights in document order
 */
public record FlightInput(LocalDate day, List<Flight> flights) {}
