package io.buildflow.backend.session;

import java.time.Instant;
import java.util.UUID;

/** Public view of a session; the token hash is never exposed. */
public record SessionResponse(
    UUID id,
    UUID userId,
    String ipAddress,
    String userAgent,
    Instant lastActivityAt,
    Instant expiresAt,
    Instant createdAt) {

  public static SessionResponse from(UserSession session) {
    return new SessionResponse(
        session.id(),
        session.userId(),
        session.ipAddress(),
        session.userAgent(),
        session.lastActivityAt(),
        session.expiresAt(),
        session.createdAt());
  }
}
