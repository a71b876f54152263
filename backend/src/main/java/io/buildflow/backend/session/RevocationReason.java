package io.buildflow.backend.session;

import java.util.Locale;

/** Values written to {@code user_sessions.revoked_reason}. */
public enum RevocationReason {
  MANUAL,
  SESSION_LIMIT,
  IDLE_TIMEOUT,
  LOGOUT_ALL;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
