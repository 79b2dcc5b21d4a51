package com.hrintake.telegram.admin;

import java.util.Map;

/**
 * Applications per position over the last {@code days} days.
 *
 * @param counts position to count, highest count first
 */
public record PositionStats(int days, long total, Map<String, Long> counts) {

  /** Key for applications stored without a position. */
  public static final String UNKNOWN = "Unknown";

  public double dailyAverage() {
    return days <= 0 ? 0 : (double) total / days;
  }

  public double percentOf(long count) {
    return total == 0 ? 0 : count * 100.0 / total;
  }
}
