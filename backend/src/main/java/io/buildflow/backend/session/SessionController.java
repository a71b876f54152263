package io.buildflow.backend.session;

import io.buildflow.backend.exception.ResourceNotFoundException;
import io.buildflow.backend.multitenancy.TenantContext;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Sessions of the signed-in user. */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

  private final SessionGovernor sessionGovernor;

  public SessionController(SessionGovernor sessionGovernor) {
    this.sessionGovernor = sessionGovernor;
  }

  @GetMapping
  public ResponseEntity<List<SessionResponse>> listSessions(
      @AuthenticationPrincipal UserSession current) {
    var sessions =
        sessionGovernor.listActiveSessions(TenantContext.requireDatabaseName(), current.userId());
    return ResponseEntity.ok(sessions.stream().map(SessionResponse::from).toList());
  }

  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> revokeSession(
      @AuthenticationPrincipal UserSession current, @PathVariable UUID sessionId) {
    String databaseName = TenantContext.requireDatabaseName();
    boolean owned =
        sessionGovernor.listActiveSessions(databaseName, current.userId()).stream()
            .anyMatch(session -> session.id().equals(sessionId));
    if (!owned) {
      throw new ResourceNotFoundException("Session", sessionId);
    }
    sessionGovernor.revokeSession(databaseName, sessionId, RevocationReason.MANUAL);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/revoke-others")
  public ResponseEntity<InternalSessionController.RevokedSessionsResponse> revokeOthers(
      @AuthenticationPrincipal UserSession current) {
    int revoked =
        sessionGovernor.revokeAllUserSessions(
            TenantContext.requireDatabaseName(), current.userId(), current.id());
    return ResponseEntity.ok(new InternalSessionController.RevokedSessionsResponse(revoked));
  }
}
