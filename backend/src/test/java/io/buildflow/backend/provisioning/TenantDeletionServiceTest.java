package io.buildflow.backend.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.buildflow.backend.exception.ResourceNotFoundException;
import io.buildflow.backend.multitenancy.TenantFilter;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class TenantDeletionServiceTest {

  private static final UUID AGENCY_ID = UUID.fromString("1a2b3c4d-0000-4000-8000-000000000001");
  private static final String DB = "agency_acme_1a2b3c4d";

  @Mock private AgencyRepository agencyRepository;
  @Mock private AgencyRegistry agencyRegistry;
  @Mock private ClusterDatabaseAdmin clusterAdmin;
  @Mock private TenantPoolRegistry poolRegistry;
  @Mock private TenantFilter tenantFilter;

  private TenantDeletionService service;

  @BeforeEach
  void setUp() {
    service =
        new TenantDeletionService(
            agencyRepository, agencyRegistry, clusterAdmin, poolRegistry, tenantFilter);
  }

  @Test
  void deleteTenant_dropSucceeds_removesRecordAfterDrop() {
    givenAgency();

    var result = service.deleteTenant(AGENCY_ID);

    assertThat(result).isEqualTo(new TenantDeletionResult(AGENCY_ID, DB, true, true));
    var order = inOrder(tenantFilter, poolRegistry, clusterAdmin, agencyRegistry);
    order.verify(tenantFilter).evictDatabase(DB);
    order.verify(poolRegistry).evict(DB);
    order.verify(clusterAdmin).dropDatabase(DB);
    order.verify(agencyRegistry).delete(AGENCY_ID);
    verify(agencyRegistry, never()).deactivate(any());
  }

  @Test
  void deleteTenant_dropFails_deactivatesAndKeepsRecord() {
    givenAgency();
    doThrow(new DataAccessResourceFailureException("database is being accessed by other users"))
        .when(clusterAdmin)
        .dropDatabase(DB);

    var result = service.deleteTenant(AGENCY_ID);

    assertThat(result.databaseDropped()).isFalse();
    assertThat(result.recordRemoved()).isFalse();
    verify(agencyRegistry).deactivate(AGENCY_ID);
    verify(agencyRegistry, never()).delete(any());
  }

  @Test
  void deleteTenant_unknownAgency_isNotFound() {
    when(agencyRepository.findById(AGENCY_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteTenant(AGENCY_ID))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(clusterAdmin, agencyRegistry, poolRegistry);
  }

  private void givenAgency() {
    var agency = new Agency(AGENCY_ID, "Acme", "acme.buildflow.app", DB, null, "starter");
    when(agencyRepository.findById(AGENCY_ID)).thenReturn(Optional.of(agency));
  }
}
