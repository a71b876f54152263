package io.buildflow.backend.session;

import io.buildflow.backend.multitenancy.TenantAccessException;
import io.buildflow.backend.provisioning.Agency;
import io.buildflow.backend.provisioning.AgencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionCleanupJob {

  private static final Logger log = LoggerFactory.getLogger(SessionCleanupJob.class);

  private final AgencyRepository agencyRepository;
  private final SessionGovernor sessionGovernor;

  public SessionCleanupJob(AgencyRepository agencyRepository, SessionGovernor sessionGovernor) {
    this.agencyRepository = agencyRepository;
    this.sessionGovernor = sessionGovernor;
  }

  @Scheduled(cron = "${buildflow.sessions.cleanup-cron:0 15 3 * * *}")
  public void cleanupExpiredSessions() {
    int total = 0;
    int failed = 0;
    for (Agency agency : agencyRepository.findAllByActiveTrue()) {
      try {
        total += sessionGovernor.cleanupExpiredSessions(agency.getDatabaseName());
      } catch (TenantAccessException | DataAccessException e) {
        failed++;
        log.warn("Session cleanup failed for {}", agency.getDatabaseName(), e);
      }
    }
    log.info("Session cleanup removed {} sessions, {} agencies failed", total, failed);
  }
}
