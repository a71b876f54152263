package io.buildflow.backend.setup;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Hands out {@code EMP-nnnn} ids continuing from the most recently created employee. A taken
 * candidate falls back to a timestamp id, then to a random one.
 */
final class EmployeeIdAllocator {

  private static final Pattern TRAILING_DIGITS = Pattern.compile("(\\d+)$");

  private final JdbcTemplate jdbc;
  private final Clock clock;
  private int lastNumber;

  EmployeeIdAllocator(JdbcTemplate jdbc, Clock clock) {
    this.jdbc = jdbc;
    this.clock = clock;
    this.lastNumber = latestNumber(jdbc);
  }

  String next() {
    lastNumber++;
    String candidate = String.format(Locale.ROOT, "EMP-%04d", lastNumber);
    if (isFree(candidate)) {
      return candidate;
    }
    String millis = String.valueOf(clock.millis());
    candidate = "EMP-" + millis.substring(millis.length() - 6);
    if (isFree(candidate)) {
      return candidate;
    }
    return "EMP-"
        + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
  }

  static int parseNumber(String employeeId) {
    if (employeeId == null) {
      return 0;
    }
    Matcher matcher = TRAILING_DIGITS.matcher(employeeId);
    if (!matcher.find()) {
      return 0;
    }
    try {
      return Integer.parseInt(matcher.group(1));
    } catch (NumberFormatException e) {
      // more digits than an int holds, e.g. a timestamp fallback id
      return 0;
    }
  }

  private boolean isFree(String employeeId) {
    Boolean taken =
        jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM employee_details WHERE employee_id = ?)",
            Boolean.class,
            employeeId);
    return !Boolean.TRUE.equals(taken);
  }

  private static int latestNumber(JdbcTemplate jdbc) {
    var latest =
        jdbc.queryForList(
            "SELECT employee_id FROM employee_details WHERE employee_id IS NOT NULL"
                + " ORDER BY created_at DESC LIMIT 1",
            String.class);
    return latest.isEmpty() ? 0 : parseNumber(latest.get(0));
  }
}
