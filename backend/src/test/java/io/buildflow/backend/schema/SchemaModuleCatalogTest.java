package io.buildflow.backend.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SchemaModuleCatalogTest {

  @Test
  void moduleForTable_findsOwningModule() {
    assertThat(SchemaModuleCatalog.moduleForTable("attendance")).contains(SchemaModule.HR);
    assertThat(SchemaModuleCatalog.moduleForTable("user_sessions")).contains(SchemaModule.AUTH);
    assertThat(SchemaModuleCatalog.moduleForTable("purchase_order_items"))
        .contains(SchemaModule.PROCUREMENT);
  }

  @Test
  void moduleForTable_acceptsQualifiedAndQuotedNames() {
    assertThat(SchemaModuleCatalog.moduleForTable("public.\"Leads\"")).contains(SchemaModule.CRM);
    assertThat(SchemaModuleCatalog.moduleForTable(" PUBLIC.invoices "))
        .contains(SchemaModule.CLIENTS_FINANCIAL);
  }

  @Test
  void moduleForTable_unknownOrBlankIsEmpty() {
    assertThat(SchemaModuleCatalog.moduleForTable("pg_stat_activity")).isEmpty();
    assertThat(SchemaModuleCatalog.moduleForTable("")).isEmpty();
    assertThat(SchemaModuleCatalog.moduleForTable(null)).isEmpty();
  }

  @Test
  void requiredTables_areOwnedByModules() {
    assertThat(SchemaModuleCatalog.REQUIRED_TABLES)
        .allSatisfy(table -> assertThat(SchemaModuleCatalog.moduleForTable(table)).isPresent());
  }

  @Test
  void tableIndex_coversEveryDeclaredTableOnce() {
    int declared = Arrays.stream(SchemaModule.values()).mapToInt(m -> m.tables().size()).sum();

    assertThat(SchemaModuleCatalog.tableIndex()).hasSize(declared);
  }

  @Test
  void loadScript_everyModuleScriptIsPresentAndNonDestructive() {
    for (SchemaModule module : SchemaModule.values()) {
      String sql = SchemaModuleCatalog.loadScript(module);

      assertThat(sql).as(module.scriptPath()).isNotBlank();
      for (String table : module.tables()) {
        assertThat(sql).as(module + " creates " + table).containsIgnoringCase(table);
      }
    }
  }

  @Test
  void loadScript_scriptsAvoidDollarQuoting() {
    // ScriptUtils splits on semicolons and does not understand dollar-quoted bodies
    for (SchemaModule module : SchemaModule.values()) {
      assertThat(SchemaModuleCatalog.loadScript(module))
          .as(module.scriptPath())
          .doesNotContain("$$");
    }
  }
}
