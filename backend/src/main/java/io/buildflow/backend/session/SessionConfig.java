package io.buildflow.backend.session;

import java.time.Duration;

/** Session policy of one agency. */
public record SessionConfig(
    Duration timeout,
    int maxConcurrentSessions,
    Duration idleTimeout,
    boolean deviceTracking,
    boolean requireReauthOnSensitive) {

  /** Fills unset or non-positive values from the defaults. */
  public SessionConfig withDefaults(SessionConfig defaults) {
    return new SessionConfig(
        isPositive(timeout) ? timeout : defaults.timeout(),
        maxConcurrentSessions > 0 ? maxConcurrentSessions : defaults.maxConcurrentSessions(),
        isPositive(idleTimeout) ? idleTimeout : defaults.idleTimeout(),
        deviceTracking,
        requireReauthOnSensitive);
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }
}
