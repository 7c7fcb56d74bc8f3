package com.standcapacity.engine.allocation;

import java.util.List;

/** Non-fatal observation about the flight list made while allocating. */
public record AllocationIssue(IssueType type, List<String> flightIds, String message) {}
