package io.buildflow.backend.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.buildflow.backend.multitenancy.TenantConnection;
import io.buildflow.backend.multitenancy.TenantPoolRegistry;
import java.sql.Connection;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

@ExtendWith(MockitoExtension.class)
class ReactiveSchemaRepairTest {

  private static final String DB = "agency_acme_1a2b3c4d";

  // Fields exactly as PostgreSQL sends them for an unknown table: no table field.
  private static final String MISSING_COMPANY_EVENTS =
      "SERROR\0VERROR\0C42P01\0Mrelation \"company_events\" does not exist\0P22\0"
          + "Fparse_relation.c\0L1392\0RparserOpenTable\0";

  @Mock private SchemaRepairEngine engine;
  @Mock private TenantPoolRegistry poolRegistry;
  @Mock private TenantConnection tenantConnection;
  @Mock private Connection connection;

  private ReactiveSchemaRepair repair;

  @BeforeEach
  void setUp() {
    lenient().when(poolRegistry.acquire(DB)).thenReturn(tenantConnection);
    lenient().when(tenantConnection.connection()).thenReturn(connection);
    repair = new ReactiveSchemaRepair(engine, poolRegistry, properties(true));
  }

  @Test
  void missingRelation_serverErrorForUnknownTable_carriesNoTableName() {
    var failure = new PSQLException(new ServerErrorMessage(MISSING_COMPANY_EVENTS));

    assertThat(failure.getSQLState()).isEqualTo("42P01");
    assertThat(ReactiveSchemaRepair.missingRelation(failure)).isEmpty();
  }

  @Test
  void repairMissingRelation_realServerError_ensuresOnlyIncompleteDeclaredModule() {
    var failure = new PSQLException(new ServerErrorMessage(MISSING_COMPANY_EVENTS));
    Set<SchemaModule> declared = Set.of(SchemaModule.AUTH, SchemaModule.MISC);
    when(engine.incompleteModules(connection, declared)).thenReturn(List.of(SchemaModule.MISC));

    boolean repaired = repair.repairMissingRelation(DB, failure, declared);

    assertThat(repaired).isTrue();
    verify(engine).ensureModule(connection, SchemaModule.MISC);
    verify(engine, never()).ensureModule(connection, SchemaModule.AUTH);
    verify(engine, never()).incompleteModules(connection);
  }

  @Test
  void repairMissingRelation_tableReportedByServer_takesPrecedence() {
    var failure =
        new PSQLException(
            new ServerErrorMessage("SERROR\0C42P01\0Mrelation missing\0tholidays\0"));

    boolean repaired = repair.repairMissingRelation(DB, failure, Set.of(SchemaModule.HR));

    assertThat(repaired).isTrue();
    verify(engine).ensureModule(connection, SchemaModule.MISC);
    verify(engine, never()).incompleteModules(any(), any());
  }

  @Test
  void repairMissingRelation_declaredModulesComplete_declinesRepair() {
    var failure = new PSQLException(new ServerErrorMessage(MISSING_COMPANY_EVENTS));
    when(engine.incompleteModules(connection, Set.of(SchemaModule.AUTH))).thenReturn(List.of());

    assertThat(repair.repairMissingRelation(DB, failure, Set.of(SchemaModule.AUTH))).isFalse();
    verify(engine, never()).ensureModule(any(), any());
  }

  @Test
  void repairMissingRelation_nothingDeclared_checksWholeSchema() {
    var failure = new PSQLException(new ServerErrorMessage(MISSING_COMPANY_EVENTS));
    when(engine.incompleteModules(connection)).thenReturn(List.of(SchemaModule.MISC));

    assertThat(repair.repairMissingRelation(DB, failure, Set.of())).isTrue();
    verify(engine).ensureModule(connection, SchemaModule.MISC);
  }

  @Test
  void repairMissingRelation_withinCooldown_isSkipped() {
    var failure = new PSQLException(new ServerErrorMessage(MISSING_COMPANY_EVENTS));
    Set<SchemaModule> declared = Set.of(SchemaModule.MISC);
    when(engine.incompleteModules(connection, declared)).thenReturn(List.of(SchemaModule.MISC));

    assertThat(repair.repairMissingRelation(DB, failure, declared)).isTrue();
    assertThat(repair.repairMissingRelation(DB, failure, declared)).isFalse();
    verify(engine).ensureModule(connection, SchemaModule.MISC);
  }

  @Test
  void repairMissingRelation_disabled_doesNothing() {
    var disabled = new ReactiveSchemaRepair(engine, poolRegistry, properties(false));
    var failure = new PSQLException(new ServerErrorMessage(MISSING_COMPANY_EVENTS));

    assertThat(disabled.repairMissingRelation(DB, failure, Set.of(SchemaModule.MISC))).isFalse();
    verifyNoInteractions(engine);
  }

  private static SchemaRepairProperties properties(boolean enabled) {
    return new SchemaRepairProperties(
        enabled, Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofSeconds(30));
  }
}
