package io.intellixity.querydog.server.service;

import java.util.List;
import java.util.Map;

/**
 * @param stats updated statistics, or null when the run was not tied to a file
 */
public record SavedQueryRun(List<Map<String, Object>> data, int rowCount, long duration, RunStats stats) {}
