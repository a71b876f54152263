package io.buildflow.backend.session;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * SQL over {@code user_sessions} and {@code session_config} of one agency database. Callers pass
 * the {@link JdbcTemplate} bound to a borrowed tenant connection.
 */
@Repository
public class SessionRepository {

  private static final String COLUMNS =
      "id, user_id, token_hash, ip_address, user_agent, device_info::text AS device_info,"
          + " last_activity_at, expires_at, created_at, revoked_at, revoked_reason";

  private static final RowMapper<UserSession> SESSION_MAPPER = SessionRepository::mapSession;

  /** Serializes session creation for one user until the surrounding transaction ends. */
  public void lockUser(JdbcTemplate jdbc, UUID userId) {
    jdbc.queryForList("SELECT pg_advisory_xact_lock(hashtext(?))", "user_sessions:" + userId);
  }

  /** Non-revoked, unexpired sessions of the user, most recently active first. */
  public List<UserSession> findActive(JdbcTemplate jdbc, UUID userId, Instant now) {
    return jdbc.query(
        "SELECT "
            + COLUMNS
            + " FROM user_sessions"
            + " WHERE user_id = ? AND is_active = true AND revoked_at IS NULL AND expires_at > ?"
            + " ORDER BY last_activity_at DESC",
        SESSION_MAPPER,
        userId,
        Timestamp.from(now));
  }

  public Optional<UserSession> findByTokenHash(JdbcTemplate jdbc, String tokenHash) {
    return jdbc
        .query(
            "SELECT " + COLUMNS + " FROM user_sessions WHERE token_hash = ?",
            SESSION_MAPPER,
            tokenHash)
        .stream()
        .findFirst();
  }

  public Optional<UserSession> findById(JdbcTemplate jdbc, UUID sessionId) {
    return jdbc
        .query("SELECT " + COLUMNS + " FROM user_sessions WHERE id = ?", SESSION_MAPPER, sessionId)
        .stream()
        .findFirst();
  }

  public UserSession insert(
      JdbcTemplate jdbc,
      UUID userId,
      String tokenHash,
      String ipAddress,
      String userAgent,
      String deviceInfoJson,
      Instant now,
      Instant expiresAt) {
    return jdbc.queryForObject(
        "INSERT INTO user_sessions"
            + " (user_id, token_hash, ip_address, user_agent, device_info, is_active,"
            + " last_activity_at, expires_at, created_at)"
            + " VALUES (?, ?, ?, ?, ?::jsonb, true, ?, ?, ?)"
            + " RETURNING "
            + COLUMNS,
        SESSION_MAPPER,
        userId,
        tokenHash,
        ipAddress,
        userAgent,
        deviceInfoJson,
        Timestamp.from(now),
        Timestamp.from(expiresAt),
        Timestamp.from(now));
  }

  /** Returns false when the session was already revoked or does not exist. */
  public boolean revoke(JdbcTemplate jdbc, UUID sessionId, String reason, Instant now) {
    return jdbc.update(
            "UPDATE user_sessions SET is_active = false, revoked_at = ?, revoked_reason = ?"
                + " WHERE id = ? AND revoked_at IS NULL",
            Timestamp.from(now),
            reason,
            sessionId)
        > 0;
  }

  /** Revokes every open session of the user except one, returning the revoked token hashes. */
  public List<String> revokeAllForUser(
      JdbcTemplate jdbc, UUID userId, UUID exceptSessionId, String reason, Instant now) {
    return jdbc.queryForList(
        "UPDATE user_sessions SET is_active = false, revoked_at = ?, revoked_reason = ?"
            + " WHERE user_id = ? AND is_active = true AND revoked_at IS NULL"
            + " AND (CAST(? AS uuid) IS NULL OR id <> ?)"
            + " RETURNING token_hash",
        String.class,
        Timestamp.from(now),
        reason,
        userId,
        exceptSessionId,
        exceptSessionId);
  }

  /** Returns false when the session has been revoked or has expired in the meantime. */
  public boolean touch(JdbcTemplate jdbc, UUID sessionId, Instant now) {
    return jdbc.update(
            "UPDATE user_sessions SET last_activity_at = ?"
                + " WHERE id = ? AND is_active = true AND revoked_at IS NULL AND expires_at > ?",
            Timestamp.from(now),
            sessionId,
            Timestamp.from(now))
        > 0;
  }

  /** Deletes expired and revoked sessions, returning their token hashes. */
  public List<String> deleteExpired(JdbcTemplate jdbc, Instant now) {
    return jdbc.queryForList(
        "DELETE FROM user_sessions WHERE expires_at <= ? OR revoked_at IS NOT NULL"
            + " RETURNING token_hash",
        String.class,
        Timestamp.from(now));
  }

  public Optional<SessionConfig> findConfig(JdbcTemplate jdbc) {
    return jdbc
        .query(
            "SELECT timeout_seconds, max_concurrent_sessions, idle_timeout_seconds,"
                + " device_tracking, require_reauth_on_sensitive FROM session_config WHERE id = 1",
            (rs, rowNum) ->
                new SessionConfig(
                    Duration.ofSeconds(rs.getLong("timeout_seconds")),
                    rs.getInt("max_concurrent_sessions"),
                    Duration.ofSeconds(rs.getLong("idle_timeout_seconds")),
                    rs.getBoolean("device_tracking"),
                    rs.getBoolean("require_reauth_on_sensitive")))
        .stream()
        .findFirst();
  }

  public void saveConfig(JdbcTemplate jdbc, SessionConfig config) {
    jdbc.update(
        """
        INSERT INTO session_config
            (id, timeout_seconds, max_concurrent_sessions, idle_timeout_seconds, device_tracking,
             require_reauth_on_sensitive, updated_at)
        VALUES (1, ?, ?, ?, ?, ?, now())
        ON CONFLICT (id) DO UPDATE SET
            timeout_seconds = EXCLUDED.timeout_seconds,
            max_concurrent_sessions = EXCLUDED.max_concurrent_sessions,
            idle_timeout_seconds = EXCLUDED.idle_timeout_seconds,
            device_tracking = EXCLUDED.device_tracking,
            require_reauth_on_sensitive = EXCLUDED.require_reauth_on_sensitive,
            updated_at = now()
        """,
        config.timeout().toSeconds(),
        config.maxConcurrentSessions(),
        config.idleTimeout().toSeconds(),
        config.deviceTracking(),
        config.requireReauthOnSensitive());
  }

  private static UserSession mapSession(ResultSet rs, int rowNum) throws SQLException {
    return new UserSession(
        rs.getObject("id", UUID.class),
        rs.getObject("user_id", UUID.class),
        rs.getString("token_hash"),
        rs.getString("ip_address"),
        rs.getString("user_agent"),
        rs.getString("device_info"),
        toInstant(rs.getTimestamp("last_activity_at")),
        toInstant(rs.getTimestamp("expires_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("revoked_at")),
        rs.getString("revoked_reason"));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }
}
