package io.buildflow.backend.provisioning;

import io.buildflow.backend.exception.ResourceNotFoundException;
import io.buildflow.backend.multitenancy.TenantFilter;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Removes an agency: its pool, its database and its registry entry, in that order. When the
 * database cannot be dropped the entry is only deactivated: the agency stops routing, its domain
 * stays reserved, and calling {@link #deleteTenant} again retries the drop.
 */
@Service
public class TenantDeletionService {

  private static final Logger log = LoggerFactory.getLogger(TenantDeletionService.class);

  private final AgencyRepository agencyRepository;
  private final AgencyRegistry agencyRegistry;
  private final ClusterDatabaseAdmin clusterAdmin;
  private final TenantPoolRegistry poolRegistry;
  private final TenantFilter tenantFilter;

  public TenantDeletionService(
      AgencyRepository agencyRepository,
      AgencyRegistry agencyRegistry,
      ClusterDatabaseAdmin clusterAdmin,
      TenantPoolRegistry poolRegistry,
      TenantFilter tenantFilter) {
    this.agencyRepository = agencyRepository;
    this.agencyRegistry = agencyRegistry;
    this.clusterAdmin = clusterAdmin;
    this.poolRegistry = poolRegistry;
    this.tenantFilter = tenantFilter;
  }

  public TenantDeletionResult deleteTenant(UUID agencyId) {
    Agency agency =
        agencyRepository
            .findById(agencyId)
            .orElseThrow(() -> new ResourceNotFoundException("Agency", agencyId));
    String databaseName = agency.getDatabaseName();
    log.info("Deleting agency {} with database {}", agencyId, databaseName);

    tenantFilter.evictDatabase(databaseName);
    poolRegistry.evict(databaseName);

    boolean dropped;
    try {
      clusterAdmin.dropDatabase(databaseName);
      dropped = true;
    } catch (RuntimeException e) {
      dropped = false;
      log.error(
          "Could not drop database {} of agency {}, drop it manually with:"
              + " DROP DATABASE IF EXISTS \"{}\"",
          databaseName,
          agencyId,
          databaseName,
          e);
    }

    if (!dropped) {
      agencyRegistry.deactivate(agencyId);
      log.warn("Agency {} deactivated, its record is kept until the database is dropped", agencyId);
      return new TenantDeletionResult(agencyId, databaseName, false, false);
    }
    agencyRegistry.delete(agencyId);
    log.info("Deleted agency {} and database {}", agencyId, databaseName);
    return new TenantDeletionResult(agencyId, databaseName, true, true);
  }
}
