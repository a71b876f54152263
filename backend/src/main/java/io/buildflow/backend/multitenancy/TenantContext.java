package io.buildflow.backend.multitenancy;

/** Tenant database bound to the current request thread by {@link TenantFilter}. */
public final class TenantContext {

  private static final ThreadLocal<String> CURRENT_DATABASE = new ThreadLocal<>();

  private TenantContext() {}

  public static void setDatabaseName(String databaseName) {
    CURRENT_DATABASE.set(databaseName);
  }

  public static String getDatabaseName() {
    return CURRENT_DATABASE.get();
  }

  public static String requireDatabaseName() {
    String databaseName = CURRENT_DATABASE.get();
    if (databaseName == null) {
      throw new IllegalStateException("No tenant database bound to the current request");
    }
    return databaseName;
  }

  public static void clear() {
    CURRENT_DATABASE.remove();
  }
}
