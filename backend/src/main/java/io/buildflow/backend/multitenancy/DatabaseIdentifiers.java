package io.buildflow.backend.multitenancy;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation and quoting for database names embedded in SQL text. Every tenant database name goes
 * through {@link #quote(String)} before it is concatenated into a statement.
 */
public final class DatabaseIdentifiers {

  public static final int MAX_IDENTIFIER_BYTES = 63;

  private static final Pattern IDENTIFIER_PATTERN =
      Pattern.compile("^[a-z_][a-z0-9_-]*$", Pattern.CASE_INSENSITIVE);

  private static final Set<String> RESERVED_WORDS =
      Set.of(
          "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric", "both",
          "case", "cast", "check", "collate", "column", "constraint", "create", "current_catalog",
          "current_date", "current_role", "current_time", "current_timestamp", "current_user",
          "default", "deferrable", "desc", "distinct", "do", "else", "end", "except", "false",
          "fetch", "for", "foreign", "from", "grant", "group", "having", "in", "initially",
          "intersect", "into", "lateral", "leading", "limit", "localtime", "localtimestamp", "not",
          "null", "offset", "on", "only", "or", "order", "placing", "primary", "references",
          "returning", "select", "session_user", "some", "symmetric", "table", "then", "to",
          "trailing", "true", "union", "unique", "user", "using", "variadic", "when", "where",
          "window", "with", "postgres", "template0", "template1");

  private DatabaseIdentifiers() {}

  public static boolean isValid(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    if (name.getBytes(StandardCharsets.UTF_8).length > MAX_IDENTIFIER_BYTES) {
      return false;
    }
    if (!IDENTIFIER_PATTERN.matcher(name).matches()) {
      return false;
    }
    return !RESERVED_WORDS.contains(name.toLowerCase(Locale.ROOT));
  }

  /**
   * @throws InvalidDatabaseNameException when the name is empty, too long, contains characters
   *     outside {@code [A-Za-z0-9_-]}, or is a reserved word
   */
  public static String validate(String name) {
    if (!isValid(name)) {
      throw new InvalidDatabaseNameException(name);
    }
    return name;
  }

  /** Validates and double-quotes the name, doubling any embedded quote. */
  public static String quote(String name) {
    validate(name);
    return "\"" + name.replace("\"", "\"\"") + "\"";
  }
}
