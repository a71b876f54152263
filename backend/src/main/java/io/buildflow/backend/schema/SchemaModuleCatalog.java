package io.buildflow.backend.schema;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

/** Static table-to-module lookup and access to the module scripts. */
public final class SchemaModuleCatalog {

  /** Tables a tenant database must have before it is registered as usable. */
  public static final List<String> REQUIRED_TABLES =
      List.of("users", "profiles", "user_roles", "attendance");

  public static final String SCHEMA_VERSION = "3.0.0";

  private static final Pattern DESTRUCTIVE_STATEMENT =
      Pattern.compile(
          "\\b(DROP\\s+(TABLE|COLUMN|SCHEMA|DATABASE|VIEW|INDEX|FUNCTION|TYPE|CONSTRAINT)"
              + "|TRUNCATE|DELETE\\s+FROM|ALTER\\s+TABLE\\s+\\S+\\s+DROP)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Map<String, SchemaModule> MODULE_BY_TABLE = buildTableIndex();

  private SchemaModuleCatalog() {}

  /**
   * Finds the module that owns a table. Accepts schema-qualified and quoted names such as {@code
   * public."Users"}.
   */
  public static Optional<SchemaModule> moduleForTable(String tableName) {
    if (tableName == null || tableName.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(MODULE_BY_TABLE.get(normalize(tableName)));
  }

  public static Map<String, SchemaModule> tableIndex() {
    return MODULE_BY_TABLE;
  }

  /**
   * Loads a module's script and rejects it if it contains a destructive statement.
   *
   * @throws IllegalStateException if the script is destructive
   */
  public static String loadScript(SchemaModule module) {
    var resource = new ClassPathResource(module.scriptPath());
    String sql;
    try (var in = resource.getInputStream()) {
      sql = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read schema module script " + module.scriptPath(), e);
    }
    var matcher = DESTRUCTIVE_STATEMENT.matcher(stripComments(sql));
    if (matcher.find()) {
      throw new IllegalStateException(
          "Schema module " + module + " contains a destructive statement: " + matcher.group());
    }
    return sql;
  }

  static String normalize(String tableName) {
    String name = tableName.trim();
    int dot = name.lastIndexOf('.');
    if (dot >= 0) {
      name = name.substring(dot + 1);
    }
    if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
      name = name.substring(1, name.length() - 1);
    }
    return name.toLowerCase(Locale.ROOT);
  }

  private static String stripComments(String sql) {
    return sql.replaceAll("(?m)--.*$", "");
  }

  private static Map<String, SchemaModule> buildTableIndex() {
    Map<String, SchemaModule> index = new HashMap<>();
    for (SchemaModule module : SchemaModule.values()) {
      for (String table : module.tables()) {
        SchemaModule previous = index.putIfAbsent(table, module);
        if (previous != null) {
          throw new IllegalStateException(
              "Table " + table + " is claimed by both " + previous + " and " + module);
        }
      }
    }
    return Collections.unmodifiableMap(index);
  }
}
