package io.buildflow.backend.schema;

import java.util.List;

/**
 * Independently ensurable units of the tenant schema, declared in dependency order. Each module
 * owns one script under {@code db/tenant-modules/} and guarantees the listed tables after it runs.
 */
public enum SchemaModule {
  SHARED_FUNCTIONS("00-shared-functions.sql", List.of("schema_info")),
  AUTH(
      "01-auth.sql",
      List.of(
          "users",
          "profiles",
          "user_roles",
          "audit_logs",
          "permissions",
          "role_permissions",
          "user_permissions",
          "user_preferences",
          "user_sessions",
          "session_config")),
  AGENCIES("02-agencies.sql", List.of("agency_settings")),
  DEPARTMENTS(
      "03-departments.sql",
      List.of("departments", "team_assignments", "department_hierarchy", "team_members")),
  HR(
      "04-hr.sql",
      List.of(
          "employee_details",
          "attendance",
          "leave_types",
          "leave_requests",
          "payroll_periods",
          "payroll",
          "employee_salary_details",
          "employee_files")),
  PROJECTS_TASKS(
      "05-projects-tasks.sql",
      List.of("projects", "tasks", "task_assignments", "task_comments", "task_time_tracking")),
  CLIENTS_FINANCIAL(
      "06-clients-financial.sql",
      List.of(
          "clients",
          "invoices",
          "invoice_items",
          "quotations",
          "quotation_items",
          "chart_of_accounts",
          "journal_entries",
          "journal_entry_lines",
          "jobs",
          "job_cost_items")),
  CRM("07-crm.sql", List.of("lead_sources", "leads", "crm_activities", "sales_pipeline")),
  GST("08-gst.sql", List.of("gst_settings", "gst_returns", "gst_transactions")),
  REIMBURSEMENT(
      "09-reimbursement.sql",
      List.of(
          "expense_categories",
          "reimbursement_requests",
          "reimbursement_attachments",
          "receipts")),
  DOCUMENTS(
      "10-documents.sql",
      List.of(
          "document_folders",
          "documents",
          "document_versions",
          "document_permissions",
          "file_storage")),
  MESSAGING("11-messaging.sql", List.of("message_channels", "channel_members", "messages")),
  INVENTORY(
      "12-inventory.sql",
      List.of("warehouses", "products", "inventory_levels", "inventory_transactions")),
  PROCUREMENT(
      "13-procurement.sql", List.of("suppliers", "purchase_orders", "purchase_order_items")),
  FINANCIAL("14-financial.sql", List.of("currencies", "bank_accounts", "budgets")),
  REPORTING("15-reporting.sql", List.of("reports", "report_schedules")),
  ASSETS("16-assets.sql", List.of("asset_categories", "assets", "asset_maintenance")),
  WORKFLOWS("17-workflows.sql", List.of("workflows", "workflow_steps", "workflow_instances")),
  INTEGRATIONS("18-integrations.sql", List.of("api_keys", "integrations", "integration_logs")),
  MISC(
      "19-misc.sql",
      List.of("holidays", "company_events", "feature_flags", "module_settings", "notifications"));

  static final String SCRIPT_LOCATION = "db/tenant-modules/";

  private final String scriptName;
  private final List<String> tables;

  SchemaModule(String scriptName, List<String> tables) {
    this.scriptName = scriptName;
    this.tables = tables;
  }

  public String scriptPath() {
    return SCRIPT_LOCATION + scriptName;
  }

  public List<String> tables() {
    return tables;
  }
}
