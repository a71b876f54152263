package io.buildflow.backend.exception;

import io.buildflow.backend.multitenancy.TenantAccessException;
import io.buildflow.backend.multitenancy.TenantConfigInvalidException;
import io.buildflow.backend.multitenancy.TenantDatabaseNotFoundException;
import io.buildflow.backend.provisioning.ProvisioningPhaseFailedException;
import io.buildflow.backend.schema.SchemaVerificationFailedException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(TenantAccessException.class)
  public ResponseEntity<ProblemDetail> handleTenantAccess(
      TenantAccessException ex, HttpServletRequest request) {
    HttpStatus status;
    String title;
    if (ex instanceof TenantDatabaseNotFoundException) {
      status = HttpStatus.NOT_FOUND;
      title = "Agency database not found";
    } else if (ex instanceof TenantConfigInvalidException) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
      title = "Agency database misconfigured";
    } else {
      status = HttpStatus.SERVICE_UNAVAILABLE;
      title = "Agency database unavailable";
    }

    if (status.is5xxServerError()) {
      log.error(
          "Tenant access failed: path={}, database={}, retryable={}",
          request.getRequestURI(),
          ex.getDatabaseName(),
          ex.isRetryable(),
          ex);
    } else {
      log.warn(
          "Tenant database not found: path={}, database={}",
          request.getRequestURI(),
          ex.getDatabaseName());
    }

    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(ex.getMessage());
    problem.setProperty("database", ex.getDatabaseName());
    problem.setProperty("retryable", ex.isRetryable());
    return ResponseEntity.status(status).body(problem);
  }

  @ExceptionHandler(ProvisioningPhaseFailedException.class)
  public ResponseEntity<ProblemDetail> handleProvisioningFailed(
      ProvisioningPhaseFailedException ex) {
    log.error("Provisioning failed in phase {} for {}", ex.getPhase(), ex.getDatabaseName(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Provisioning failed");
    problem.setDetail("Agency provisioning failed during " + ex.getPhase());
    problem.setProperty("phase", ex.getPhase().name());
    if (ex.getCause() instanceof SchemaVerificationFailedException verification) {
      problem.setProperty("missingTables", verification.getMissingTables());
    }
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(SchemaVerificationFailedException.class)
  public ResponseEntity<ProblemDetail> handleSchemaVerificationFailed(
      SchemaVerificationFailedException ex) {
    log.error("Schema verification failed for {}: {}", ex.getDatabaseName(), ex.getMissingTables());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Schema verification failed");
    problem.setDetail("Required tables are missing");
    problem.setProperty("missingTables", ex.getMissingTables());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Rejected request: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }
}
