package io.buildflow.backend.provisioning;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory record of how far one tenant creation got. Never persisted; compensation reads it to
 * decide what to undo.
 */
final class ProvisioningTransaction {

  private final String domain;
  private final String databaseName;
  private boolean domainChecked;
  private boolean databaseCreateIssued;
  private boolean databaseCreated;
  private boolean schemaCreated;
  private boolean settingsSeeded;
  private boolean adminUserCreated;
  private boolean rolesAssigned;
  private boolean mainRecordCommitted;

  ProvisioningTransaction(String domain, String databaseName) {
    this.domain = domain;
    this.databaseName = databaseName;
  }

  String domain() {
    return domain;
  }

  String databaseName() {
    return databaseName;
  }

  void markDomainChecked() {
    domainChecked = true;
  }

  /** Set before CREATE DATABASE is sent; the database may exist even if the call then fails. */
  void markDatabaseCreateIssued() {
    databaseCreateIssued = true;
  }

  void markDatabaseCreated() {
    databaseCreated = true;
  }

  void markSchemaCreated() {
    schemaCreated = true;
  }

  void markSettingsSeeded() {
    settingsSeeded = true;
  }

  void markAdminCreated() {
    adminUserCreated = true;
    rolesAssigned = true;
  }

  void markMainRecordCommitted() {
    mainRecordCommitted = true;
  }

  boolean isDatabaseCreated() {
    return databaseCreated;
  }

  boolean isDatabaseCreateIssued() {
    return databaseCreateIssued;
  }

  boolean isMainRecordCommitted() {
    return mainRecordCommitted;
  }

  List<String> completedSteps() {
    var steps = new ArrayList<String>();
    if (domainChecked) {
      steps.add("domainChecked");
    }
    if (databaseCreated) {
      steps.add("databaseCreated");
    }
    if (schemaCreated) {
      steps.add("schemaCreated");
    }
    if (settingsSeeded) {
      steps.add("settingsSeeded");
    }
    if (adminUserCreated) {
      steps.add("adminUserCreated");
    }
    if (rolesAssigned) {
      steps.add("rolesAssigned");
    }
    if (mainRecordCommitted) {
      steps.add("mainRecordCommitted");
    }
    return steps;
  }
}
