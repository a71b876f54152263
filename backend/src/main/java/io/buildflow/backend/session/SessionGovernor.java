package io.buildflow.backend.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.buildflow.backend.multitenancy.TenantJdbc;
import io.buildflow.backend.schema.SchemaModule;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Bounds the number of concurrent sessions per user of an agency.
 *
 * <p>Sessions are stored in the agency database and mirrored in an in-process cache keyed by
 * database and token hash. Validation reads the cache first and falls back to the database on a
 * miss. Every successful validation also refreshes the stored activity time of a still-open
 * session, so a session revoked by another instance stops validating on its next use. When a user
 * is at the ceiling, creating a session revokes the least recently active one first.
 */
@Service
public class SessionGovernor {

  private static final Logger log = LoggerFactory.getLogger(SessionGovernor.class);
  private static final Set<SchemaModule> SESSION_MODULES = Set.of(SchemaModule.AUTH);

  private final TenantJdbc tenantJdbc;
  private final SessionRepository repository;
  private final SessionProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Cache<String, UserSession> cache;

  @Autowired
  public SessionGovernor(
      TenantJdbc tenantJdbc,
      SessionRepository repository,
      SessionProperties properties,
      ObjectMapper objectMapper) {
    this(tenantJdbc, repository, properties, objectMapper, Clock.systemUTC());
  }

  SessionGovernor(
      TenantJdbc tenantJdbc,
      SessionRepository repository,
      SessionProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.tenantJdbc = tenantJdbc;
    this.repository = repository;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.cacheSize())
            .expireAfterWrite(properties.timeout())
            .build();
  }

  /**
   * Records a new session for the user. If the user already holds the maximum number of active
   * sessions, the least recently active ones are revoked with reason {@code session_limit}.
   */
  public UserSession createSession(
      String databaseName,
      UUID userId,
      String token,
      String ipAddress,
      String userAgent,
      Map<String, Object> deviceInfo) {
    String tokenHash = SessionTokens.hash(token);
    String deviceInfoJson = toJson(deviceInfo);
    List<String> evictedHashes = new ArrayList<>();

    UserSession session =
        tenantJdbc.inTransaction(
            databaseName,
            SESSION_MODULES,
            jdbc -> {
              SessionConfig config = loadConfig(jdbc);
              Instant now = clock.instant();
              repository.lockUser(jdbc, userId);

              List<UserSession> active = new ArrayList<>(repository.findActive(jdbc, userId, now));
              active.sort(Comparator.comparing(UserSession::lastActivityAt));
              while (!active.isEmpty() && active.size() >= config.maxConcurrentSessions()) {
                UserSession oldest = active.remove(0);
                repository.revoke(jdbc, oldest.id(), RevocationReason.SESSION_LIMIT.value(), now);
                evictedHashes.add(oldest.tokenHash());
                log.info(
                    "User {} reached {} sessions on {}, revoked least recently active session {}",
                    userId,
                    config.maxConcurrentSessions(),
                    databaseName,
                    oldest.id());
              }

              return repository.insert(
                  jdbc,
                  userId,
                  tokenHash,
                  ipAddress,
                  userAgent,
                  deviceInfoJson,
                  now,
                  now.plus(config.timeout()));
            });

    evictedHashes.forEach(hash -> cache.invalidate(cacheKey(databaseName, hash)));
    cache.put(cacheKey(databaseName, tokenHash), session);
    log.debug("Created session {} for user {} on {}", session.id(), userId, databaseName);
    return session;
  }

  /**
   * Returns the session for the token if it is still usable and refreshes its activity time. A
   * session idle for longer than the idle timeout is revoked with reason {@code idle_timeout}.
   */
  public Optional<UserSession> validateSession(String databaseName, String token) {
    String tokenHash = SessionTokens.hash(token);
    String key = cacheKey(databaseName, tokenHash);

    return tenantJdbc.query(
        databaseName,
        SESSION_MODULES,
        jdbc -> {
          Instant now = clock.instant();
          UserSession session = cache.getIfPresent(key);
          if (session == null) {
            session = repository.findByTokenHash(jdbc, tokenHash).orElse(null);
            if (session == null) {
              return Optional.<UserSession>empty();
            }
          }
          if (session.isRevoked() || session.isExpiredAt(now)) {
            cache.invalidate(key);
            return Optional.<UserSession>empty();
          }

          SessionConfig config = loadConfig(jdbc);
          if (session.isIdleAt(now, config.idleTimeout())) {
            repository.revoke(jdbc, session.id(), RevocationReason.IDLE_TIMEOUT.value(), now);
            cache.invalidate(key);
            log.info("Session {} on {} revoked after idle timeout", session.id(), databaseName);
            return Optional.<UserSession>empty();
          }

          if (!repository.touch(jdbc, session.id(), now)) {
            cache.invalidate(key);
            log.debug("Session {} on {} is no longer open", session.id(), databaseName);
            return Optional.<UserSession>empty();
          }
          UserSession touched = session.touchedAt(now);
          cache.put(key, touched);
          return Optional.of(touched);
        });
  }

  public List<UserSession> listActiveSessions(String databaseName, UUID userId) {
    return tenantJdbc.query(
        databaseName,
        SESSION_MODULES,
        jdbc -> repository.findActive(jdbc, userId, clock.instant()));
  }

  /** Returns false if the session does not exist or was already revoked. */
  public boolean revokeSession(String databaseName, UUID sessionId, RevocationReason reason) {
    List<String> revokedHashes = new ArrayList<>();
    boolean revoked =
        tenantJdbc.inTransaction(
            databaseName,
            SESSION_MODULES,
            jdbc -> {
              Optional<UserSession> session = repository.findById(jdbc, sessionId);
              if (session.isEmpty()) {
                return false;
              }
              revokedHashes.add(session.get().tokenHash());
              return repository.revoke(jdbc, sessionId, reason.value(), clock.instant());
            });
    // only once the revocation has committed
    revokedHashes.forEach(hash -> cache.invalidate(cacheKey(databaseName, hash)));
    return revoked;
  }

  /** Revokes every open session of the user except {@code exceptSessionId}, which may be null. */
  public int revokeAllUserSessions(String databaseName, UUID userId, UUID exceptSessionId) {
    List<String> hashes =
        tenantJdbc.inTransaction(
            databaseName,
            SESSION_MODULES,
            jdbc ->
                repository.revokeAllForUser(
                    jdbc,
                    userId,
                    exceptSessionId,
                    RevocationReason.LOGOUT_ALL.value(),
                    clock.instant()));
    hashes.forEach(hash -> cache.invalidate(cacheKey(databaseName, hash)));
    log.info("Revoked {} sessions of user {} on {}", hashes.size(), userId, databaseName);
    return hashes.size();
  }

  public SessionConfig getSessionConfig(String databaseName) {
    return tenantJdbc.query(databaseName, SESSION_MODULES, this::loadConfig);
  }

  public SessionConfig updateSessionConfig(String databaseName, SessionConfig config) {
    SessionConfig effective = config.withDefaults(properties.toConfig());
    tenantJdbc.inTransaction(
        databaseName,
        SESSION_MODULES,
        jdbc -> {
          repository.saveConfig(jdbc, effective);
          return null;
        });
    log.info("Updated session config of {}: {}", databaseName, effective);
    return effective;
  }

  /** Deletes expired and revoked sessions of the agency. */
  public int cleanupExpiredSessions(String databaseName) {
    List<String> hashes =
        tenantJdbc.inTransaction(
            databaseName, SESSION_MODULES, jdbc -> repository.deleteExpired(jdbc, clock.instant()));
    hashes.forEach(hash -> cache.invalidate(cacheKey(databaseName, hash)));
    return hashes.size();
  }

  private SessionConfig loadConfig(JdbcTemplate jdbc) {
    SessionConfig defaults = properties.toConfig();
    return repository.findConfig(jdbc).map(c -> c.withDefaults(defaults)).orElse(defaults);
  }

  private String toJson(Map<String, Object> deviceInfo) {
    try {
      return objectMapper.writeValueAsString(deviceInfo != null ? deviceInfo : Map.of());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize device info", e);
    }
  }

  private static String cacheKey(String databaseName, String tokenHash) {
    return databaseName + ":" + tokenHash;
  }
}
