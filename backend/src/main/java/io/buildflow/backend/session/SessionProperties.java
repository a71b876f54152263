package io.buildflow.backend.session;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for agencies that have no {@code session_config} row.
 *
 * @param maxConcurrentSessions active sessions one user may hold
 * @param timeout hard lifetime of a session
 * @param idleTimeout a session unused for longer is revoked on its next validation
 * @param cacheSize maximum number of sessions held in the validation cache
 * @param cleanupCron schedule of the expired-session cleanup
 */
@ConfigurationProperties(prefix = "buildflow.sessions")
public record SessionProperties(
    int maxConcurrentSessions,
    Duration timeout,
    Duration idleTimeout,
    long cacheSize,
    String cleanupCron) {

  public SessionProperties {
    if (maxConcurrentSessions <= 0) {
      maxConcurrentSessions = 5;
    }
    if (timeout == null) {
      timeout = Duration.ofHours(24);
    }
    if (idleTimeout == null) {
      idleTimeout = Duration.ofMinutes(30);
    }
    if (cacheSize <= 0) {
      cacheSize = 100_000;
    }
    if (cleanupCron == null || cleanupCron.isBlank()) {
      cleanupCron = "0 15 3 * * *";
    }
  }

  public static SessionProperties defaults() {
    return new SessionProperties(0, null, null, 0, null);
  }

  SessionConfig toConfig() {
    return new SessionConfig(timeout, maxConcurrentSessions, idleTimeout, true, true);
  }
}
