package io.buildflow.backend.provisioning;

import io.buildflow.backend.multitenancy.DatabaseIdentifiers;
import java.util.Locale;
import java.util.UUID;

/**
 * Derives the tenant database name from the subdomain and agency id: {@code
 * agency_<subdomain>_<first 8 chars of id>}. The subdomain part is truncated so the name stays
 * within the PostgreSQL identifier limit.
 */
public final class DatabaseNameGenerator {

  static final String PREFIX = "agency_";
  static final String FALLBACK_SUBDOMAIN = "agency";
  private static final int ID_CHARS = 8;

  private DatabaseNameGenerator() {}

  public static String generate(String subdomain, UUID agencyId) {
    String suffix = "_" + agencyId.toString().substring(0, ID_CHARS);
    int maxBase = DatabaseIdentifiers.MAX_IDENTIFIER_BYTES - PREFIX.length() - suffix.length();
    String base = sanitize(subdomain);
    if (base.length() > maxBase) {
      base = trimUnderscores(base.substring(0, maxBase));
    }
    return DatabaseIdentifiers.validate(PREFIX + base + suffix);
  }

  static String sanitize(String subdomain) {
    if (subdomain == null) {
      return FALLBACK_SUBDOMAIN;
    }
    String sanitized =
        trimUnderscores(
            subdomain.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_").replaceAll("_+", "_"));
    return sanitized.isEmpty() ? FALLBACK_SUBDOMAIN : sanitized;
  }

  private static String trimUnderscores(String value) {
    return value.replaceAll("^_+", "").replaceAll("_+$", "");
  }
}
