package io.buildflow.backend.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.buildflow.backend.multitenancy.TenantJdbc;
import io.buildflow.backend.schema.SchemaModule;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class SessionGovernorTest {

  private static final String DB = "agency_acme_1a2b3c4d";
  private static final UUID USER_ID = UUID.fromString("00000000-0000-4000-8000-0000000000aa");
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
  private static final String TOKEN = "session-token-1";

  @Mock private TenantJdbc tenantJdbc;
  @Mock private SessionRepository repository;
  @Mock private JdbcTemplate jdbc;

  private SessionGovernor governor;

  @BeforeEach
  void setUp() {
    lenient()
        .when(tenantJdbc.query(eq(DB), eq(Set.of(SchemaModule.AUTH)), any()))
        .thenAnswer(invocation -> runWork(invocation.getArgument(2)));
    lenient()
        .when(tenantJdbc.inTransaction(eq(DB), eq(Set.of(SchemaModule.AUTH)), any()))
        .thenAnswer(invocation -> runWork(invocation.getArgument(2)));
    lenient().when(repository.findConfig(jdbc)).thenReturn(Optional.empty());
    lenient().when(repository.touch(eq(jdbc), any(), any())).thenReturn(true);
    governor =
        new SessionGovernor(
            tenantJdbc,
            repository,
            SessionProperties.defaults(),
            new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void createSession_atCeiling_revokesLeastRecentlyActive() {
    when(repository.findConfig(jdbc))
        .thenReturn(
            Optional.of(
                new SessionConfig(Duration.ofHours(8), 2, Duration.ofMinutes(30), true, true)));
    var recent = session("recent-hash", NOW.minus(Duration.ofMinutes(1)), null);
    var oldest = session("oldest-hash", NOW.minus(Duration.ofMinutes(10)), null);
    when(repository.findActive(jdbc, USER_ID, NOW)).thenReturn(List.of(recent, oldest));
    givenInsertReturns(session(SessionTokens.hash(TOKEN), NOW, null));

    var created =
        governor.createSession(DB, USER_ID, TOKEN, "10.0.0.1", "JUnit", Map.of("os", "linux"));

    assertThat(created.tokenHash()).isEqualTo(SessionTokens.hash(TOKEN));
    var order = inOrder(repository);
    order.verify(repository).lockUser(jdbc, USER_ID);
    order.verify(repository).revoke(jdbc, oldest.id(), "session_limit", NOW);
    order
        .verify(repository)
        .insert(
            eq(jdbc),
            eq(USER_ID),
            eq(SessionTokens.hash(TOKEN)),
            eq("10.0.0.1"),
            eq("JUnit"),
            eq("{\"os\":\"linux\"}"),
            eq(NOW),
            eq(NOW.plus(Duration.ofHours(8))));
    verify(repository, never()).revoke(jdbc, recent.id(), "session_limit", NOW);
  }

  @Test
  void createSession_belowCeiling_revokesNothing() {
    when(repository.findActive(jdbc, USER_ID, NOW))
        .thenReturn(List.of(session("other-hash", NOW.minus(Duration.ofMinutes(5)), null)));
    givenInsertReturns(session(SessionTokens.hash(TOKEN), NOW, null));

    governor.createSession(DB, USER_ID, TOKEN, null, null, null);

    verify(repository, never()).revoke(any(), any(), anyString(), any());
  }

  @Test
  void validateSession_cachedSession_skipsLookupAndTouches() {
    when(repository.findActive(jdbc, USER_ID, NOW)).thenReturn(List.of());
    var created = session(SessionTokens.hash(TOKEN), NOW, null);
    givenInsertReturns(created);
    governor.createSession(DB, USER_ID, TOKEN, null, null, Map.of());

    var validated = governor.validateSession(DB, TOKEN);

    assertThat(validated).map(UserSession::id).contains(created.id());
    verify(repository, never()).findByTokenHash(any(), anyString());
    verify(repository).touch(jdbc, created.id(), NOW);
  }

  @Test
  void validateSession_cachedSessionRevokedInDatabase_isRejectedAndEvicted() {
    when(repository.findActive(jdbc, USER_ID, NOW)).thenReturn(List.of());
    var created = session(SessionTokens.hash(TOKEN), NOW, null);
    givenInsertReturns(created);
    governor.createSession(DB, USER_ID, TOKEN, null, null, Map.of());
    // revoked by another instance: the stored row no longer accepts activity
    when(repository.touch(jdbc, created.id(), NOW)).thenReturn(false);
    when(repository.findByTokenHash(jdbc, created.tokenHash()))
        .thenReturn(Optional.of(session(created.tokenHash(), NOW, NOW)));

    assertThat(governor.validateSession(DB, TOKEN)).isEmpty();
    verify(repository, never()).findByTokenHash(any(), anyString());

    assertThat(governor.validateSession(DB, TOKEN)).isEmpty();
    verify(repository).findByTokenHash(jdbc, created.tokenHash());
  }

  @Test
  void revokeSession_evictsCachedSession() {
    when(repository.findActive(jdbc, USER_ID, NOW)).thenReturn(List.of());
    var created = session(SessionTokens.hash(TOKEN), NOW, null);
    givenInsertReturns(created);
    governor.createSession(DB, USER_ID, TOKEN, null, null, Map.of());
    when(repository.findById(jdbc, created.id())).thenReturn(Optional.of(created));
    when(repository.revoke(jdbc, created.id(), "manual", NOW)).thenReturn(true);
    when(repository.findByTokenHash(jdbc, created.tokenHash()))
        .thenReturn(Optional.of(session(created.tokenHash(), NOW, NOW)));

    assertThat(governor.revokeSession(DB, created.id(), RevocationReason.MANUAL)).isTrue();

    assertThat(governor.validateSession(DB, TOKEN)).isEmpty();
    verify(repository).findByTokenHash(jdbc, created.tokenHash());
  }

  @Test
  void validateSession_idleSession_isRevokedWithIdleTimeout() {
    var idle = session(SessionTokens.hash(TOKEN), NOW.minus(Duration.ofMinutes(31)), null);
    when(repository.findByTokenHash(jdbc, SessionTokens.hash(TOKEN))).thenReturn(Optional.of(idle));

    assertThat(governor.validateSession(DB, TOKEN)).isEmpty();
    verify(repository).revoke(jdbc, idle.id(), "idle_timeout", NOW);
    verify(repository, never()).touch(any(), any(), any());
  }

  @Test
  void validateSession_revokedOrExpiredSession_isRejected() {
    var revoked = session(SessionTokens.hash(TOKEN), NOW, NOW.minusSeconds(5));
    when(repository.findByTokenHash(jdbc, SessionTokens.hash(TOKEN)))
        .thenReturn(Optional.of(revoked));

    assertThat(governor.validateSession(DB, TOKEN)).isEmpty();
    verify(repository, never()).touch(any(), any(), any());
  }

  @Test
  void validateSession_unknownToken_isEmpty() {
    when(repository.findByTokenHash(jdbc, SessionTokens.hash("nope"))).thenReturn(Optional.empty());

    assertThat(governor.validateSession(DB, "nope")).isEmpty();
  }

  @Test
  void revokeAllUserSessions_dropsCachedEntries() {
    when(repository.findActive(jdbc, USER_ID, NOW)).thenReturn(List.of());
    var created = session(SessionTokens.hash(TOKEN), NOW, null);
    givenInsertReturns(created);
    governor.createSession(DB, USER_ID, TOKEN, null, null, Map.of());
    when(repository.revokeAllForUser(jdbc, USER_ID, null, "logout_all", NOW))
        .thenReturn(List.of(created.tokenHash()));
    when(repository.findByTokenHash(jdbc, created.tokenHash()))
        .thenReturn(Optional.of(session(created.tokenHash(), NOW, NOW)));

    int revoked = governor.revokeAllUserSessions(DB, USER_ID, null);

    assertThat(revoked).isEqualTo(1);
    assertThat(governor.validateSession(DB, TOKEN)).isEmpty();
    verify(repository).findByTokenHash(jdbc, created.tokenHash());
  }

  @Test
  void revokeSession_unknownSession_returnsFalse() {
    var sessionId = UUID.randomUUID();
    when(repository.findById(jdbc, sessionId)).thenReturn(Optional.empty());

    assertThat(governor.revokeSession(DB, sessionId, RevocationReason.MANUAL)).isFalse();
    verify(repository, never()).revoke(any(), any(), anyString(), any());
  }

  @Test
  void updateSessionConfig_fillsUnsetValuesFromDefaults() {
    var effective =
        governor.updateSessionConfig(
            DB, new SessionConfig(null, 0, Duration.ofMinutes(10), false, true));

    assertThat(effective.timeout()).isEqualTo(Duration.ofHours(24));
    assertThat(effective.maxConcurrentSessions()).isEqualTo(5);
    assertThat(effective.idleTimeout()).isEqualTo(Duration.ofMinutes(10));
    assertThat(effective.deviceTracking()).isFalse();
    verify(repository).saveConfig(jdbc, effective);
  }

  @Test
  void getSessionConfig_withoutRow_usesConfiguredDefaults() {
    var config = governor.getSessionConfig(DB);

    assertThat(config.maxConcurrentSessions()).isEqualTo(5);
    assertThat(config.idleTimeout()).isEqualTo(Duration.ofMinutes(30));
  }

  @Test
  void tokenHash_isLowercaseHexSha256() {
    assertThat(SessionTokens.hash("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    assertThatThrownBy(() -> SessionTokens.hash(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private Object runWork(Function<JdbcTemplate, Object> work) {
    return work.apply(jdbc);
  }

  private void givenInsertReturns(UserSession session) {
    when(repository.insert(
            eq(jdbc),
            eq(USER_ID),
            anyString(),
            any(),
            any(),
            anyString(),
            any(Instant.class),
            any(Instant.class)))
        .thenReturn(session);
  }

  private static UserSession session(String tokenHash, Instant lastActivityAt, Instant revokedAt) {
    return new UserSession(
        UUID.randomUUID(),
        USER_ID,
        tokenHash,
        null,
        null,
        "{}",
        lastActivityAt,
        NOW.plus(Duration.ofHours(4)),
        NOW.minus(Duration.ofHours(1)),
        revokedAt,
        revokedAt != null ? "manual" : null);
  }
}
