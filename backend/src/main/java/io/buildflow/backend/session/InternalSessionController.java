package io.buildflow.backend.session;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Session registration for the login service, which issues the tokens. */
@RestController
@RequestMapping("/internal/agencies/{databaseName}")
public class InternalSessionController {

  private final SessionGovernor sessionGovernor;

  public InternalSessionController(SessionGovernor sessionGovernor) {
    this.sessionGovernor = sessionGovernor;
  }

  @PostMapping("/sessions")
  public ResponseEntity<SessionResponse> createSession(
      @PathVariable String databaseName, @Valid @RequestBody CreateSessionRequest request) {
    var session =
        sessionGovernor.createSession(
            databaseName,
            request.userId(),
            request.token(),
            request.ipAddress(),
            request.userAgent(),
            request.deviceInfo());
    return ResponseEntity.created(
            URI.create("/internal/agencies/" + databaseName + "/sessions/" + session.id()))
        .body(SessionResponse.from(session));
  }

  @DeleteMapping("/users/{userId}/sessions")
  public ResponseEntity<RevokedSessionsResponse> revokeAll(
      @PathVariable String databaseName,
      @PathVariable UUID userId,
      @RequestParam(required = false) UUID exceptSessionId) {
    int revoked = sessionGovernor.revokeAllUserSessions(databaseName, userId, exceptSessionId);
    return ResponseEntity.ok(new RevokedSessionsResponse(revoked));
  }

  @GetMapping("/session-config")
  public ResponseEntity<SessionConfigResponse> getConfig(@PathVariable String databaseName) {
    return ResponseEntity.ok(
        SessionConfigResponse.from(sessionGovernor.getSessionConfig(databaseName)));
  }

  @PutMapping("/session-config")
  public ResponseEntity<SessionConfigResponse> updateConfig(
      @PathVariable String databaseName, @RequestBody SessionConfigResponse request) {
    var updated = sessionGovernor.updateSessionConfig(databaseName, request.toConfig());
    return ResponseEntity.ok(SessionConfigResponse.from(updated));
  }

  public record CreateSessionRequest(
      @NotNull(message = "userId is required") UUID userId,
      @NotBlank(message = "token is required") String token,
      String ipAddress,
      String userAgent,
      Map<String, Object> deviceInfo) {}

  public record RevokedSessionsResponse(int revoked) {}

  public record SessionConfigResponse(
      long timeoutSeconds,
      int maxConcurrentSessions,
      long idleTimeoutSeconds,
      boolean deviceTracking,
      boolean requireReauthOnSensitive) {

    static SessionConfigResponse from(SessionConfig config) {
      return new SessionConfigResponse(
          config.timeout().toSeconds(),
          config.maxConcurrentSessions(),
          config.idleTimeout().toSeconds(),
          config.deviceTracking(),
          config.requireReauthOnSensitive());
    }

    SessionConfig toConfig() {
      return new SessionConfig(
          Duration.ofSeconds(timeoutSeconds),
          maxConcurrentSessions,
          Duration.ofSeconds(idleTimeoutSeconds),
          deviceTracking,
          requireReauthOnSensitive);
    }
  }
}
