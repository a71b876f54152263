package io.buildflow.backend.session;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One login session as stored in the agency database. The raw token is never kept, only its
 * SHA-256 hash.
 */
public record UserSession(
    UUID id,
    UUID userId,
    String tokenHash,
    String ipAddress,
    String userAgent,
    String deviceInfo,
    Instant lastActivityAt,
    Instant expiresAt,
    Instant createdAt,
    Instant revokedAt,
    String revokedReason) {

  public boolean isRevoked() {
    return revokedAt != null;
  }

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public boolean isIdleAt(Instant now, Duration idleTimeout) {
    return lastActivityAt.plus(idleTimeout).isBefore(now);
  }

  UserSession touchedAt(Instant now) {
    return new UserSession(
        id,
        userId,
        tokenHash,
        ipAddress,
        userAgent,
        deviceInfo,
        now,
        expiresAt,
        createdAt,
        revokedAt,
        revokedReason);
  }
}
