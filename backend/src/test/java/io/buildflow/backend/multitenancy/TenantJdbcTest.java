package io.buildflow.backend.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.zaxxer.hikari.HikariDataSource;
import io.buildflow.backend.schema.ReactiveSchemaRepair;
import io.buildflow.backend.schema.SchemaModule;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

@ExtendWith(MockitoExtension.class)
class TenantJdbcTest {

  private static final String DB = "agency_acme_1a2b3c4d";

  @Mock private TenantPoolRegistry poolRegistry;
  @Mock private ReactiveSchemaRepair reactiveSchemaRepair;

  private TenantJdbc tenantJdbc;

  @BeforeEach
  void setUp() {
    var pool = new TenantPool(DB, mock(HikariDataSource.class));
    when(poolRegistry.acquire(DB))
        .thenAnswer(invocation -> new TenantConnection(DB, mock(Connection.class), pool));
    tenantJdbc = new TenantJdbc(poolRegistry, reactiveSchemaRepair);
  }

  @Test
  void returnsResultOfWork() {
    String result = tenantJdbc.query(DB, jdbc -> "ok");

    assertThat(result).isEqualTo("ok");
    verify(poolRegistry, times(1)).acquire(DB);
  }

  @Test
  void repairsDeclaredModulesOnMissingRelationAndRetriesOnce() {
    var missing = missingRelation();
    when(reactiveSchemaRepair.isEnabled()).thenReturn(true);
    when(reactiveSchemaRepair.repairMissingRelation(
            eq(DB), any(SQLException.class), eq(Set.of(SchemaModule.PROJECTS_TASKS))))
        .thenReturn(true);
    var attempts = new AtomicInteger();

    String result =
        tenantJdbc.query(
            DB,
            Set.of(SchemaModule.PROJECTS_TASKS),
            jdbc -> {
              if (attempts.incrementAndGet() == 1) {
                throw missing;
              }
              return "after-repair";
            });

    assertThat(result).isEqualTo("after-repair");
    assertThat(attempts).hasValue(2);
    verify(poolRegistry, times(2)).acquire(DB);
  }

  @Test
  void workWithoutDeclaredModulesPassesEmptySetToRepair() {
    when(reactiveSchemaRepair.isEnabled()).thenReturn(true);
    when(reactiveSchemaRepair.repairMissingRelation(eq(DB), any(SQLException.class), any()))
        .thenReturn(false);

    assertThatThrownBy(
            () ->
                tenantJdbc.inTransaction(
                    DB,
                    jdbc -> {
                      throw missingRelation();
                    }))
        .isInstanceOf(BadSqlGrammarException.class);
    verify(reactiveSchemaRepair).repairMissingRelation(eq(DB), any(), eq(Set.of()));
  }

  @Test
  void secondFailureAfterRepairIsNotRetriedAgain() {
    var missing = missingRelation();
    when(reactiveSchemaRepair.isEnabled()).thenReturn(true);
    when(reactiveSchemaRepair.repairMissingRelation(eq(DB), any(SQLException.class), any()))
        .thenReturn(true);
    var attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                tenantJdbc.query(
                    DB,
                    jdbc -> {
                      attempts.incrementAndGet();
                      throw missing;
                    }))
        .isSameAs(missing);
    assertThat(attempts).hasValue(2);
    verify(reactiveSchemaRepair, times(1)).repairMissingRelation(eq(DB), any(), any());
  }

  @Test
  void missingRelationWithRepairDisabledIsConfigInvalid() {
    when(reactiveSchemaRepair.isEnabled()).thenReturn(false);

    assertThatThrownBy(
            () ->
                tenantJdbc.query(
                    DB,
                    jdbc -> {
                      throw missingRelation();
                    }))
        .isInstanceOf(TenantConfigInvalidException.class)
        .hasMessageContaining(DB);
    verify(reactiveSchemaRepair, never()).repairMissingRelation(any(), any(), any());
  }

  @Test
  void declinedRepairRethrowsOriginalFailure() {
    var missing = missingRelation();
    when(reactiveSchemaRepair.isEnabled()).thenReturn(true);
    when(reactiveSchemaRepair.repairMissingRelation(eq(DB), any(SQLException.class), any()))
        .thenReturn(false);

    assertThatThrownBy(
            () ->
                tenantJdbc.query(
                    DB,
                    jdbc -> {
                      throw missing;
                    }))
        .isSameAs(missing);
  }

  @Test
  void connectionLossIsTranslatedToUnreachable() {
    assertThatThrownBy(
            () ->
                tenantJdbc.inTransaction(
                    DB,
                    jdbc -> {
                      throw new CannotGetJdbcConnectionException(
                          "lost", new SQLException("connection reset", "08006"));
                    }))
        .isInstanceOf(TenantUnreachableException.class)
        .satisfies(e -> assertThat(((TenantAccessException) e).isRetryable()).isTrue());
  }

  @Test
  void callerErrorsPassThroughUntouched() {
    var duplicate =
        new DuplicateKeyException("dup", new SQLException("duplicate key", "23505"));

    assertThatThrownBy(
            () ->
                tenantJdbc.query(
                    DB,
                    jdbc -> {
                      throw duplicate;
                    }))
        .isSameAs(duplicate);
    verify(reactiveSchemaRepair, never()).isEnabled();
  }

  private static BadSqlGrammarException missingRelation() {
    return new BadSqlGrammarException(
        "query",
        "SELECT * FROM time_entries",
        new SQLException("relation \"time_entries\" does not exist", "42P01"));
  }
}
