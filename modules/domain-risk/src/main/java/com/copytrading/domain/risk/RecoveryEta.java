package com.copytrading.domain.risk;

import java.time.Duration;

public final class RecoveryEta {
  public static final String NOT_APPLICABLE = "N/A";
  public static final String AVAILABLE_NOW = "Available now";

  private RecoveryEta() {}

  /** Formats a remaining cooldown as {@code "45 minutes"} below an hour, else {@code "1h 15m"}. */
  public static String format(Duration remaining) {
    if (remaining == null || remaining.isZero() || remaining.isNegative()) {
      return AVAILABLE_NOW;
    }
    long totalMinutes = remaining.toSeconds() / 60L;
    if (totalMinutes < 60L) {
      return totalMinutes + " minutes";
    }
    return (totalMinutes / 60L) + "h " + (totalMinutes % 60L) + "m";
  }
}
