package io.buildflow.backend.provisioning;

import java.util.Locale;

/** Normalization of requested agency domains. */
public final class DomainNames {

  private DomainNames() {}

  /** Lowercases and trims the domain, dropping any scheme and path. */
  public static String normalize(String domain) {
    if (domain == null || domain.isBlank()) {
      throw new IllegalArgumentException("domain is required");
    }
    String normalized = domain.trim().toLowerCase(Locale.ROOT);
    int scheme = normalized.indexOf("://");
    if (scheme >= 0) {
      normalized = normalized.substring(scheme + 3);
    }
    int slash = normalized.indexOf('/');
    if (slash >= 0) {
      normalized = normalized.substring(0, slash);
    }
    if (normalized.isEmpty() || normalized.startsWith(".")) {
      throw new IllegalArgumentException("Invalid domain: " + domain);
    }
    return normalized;
  }

  /** The text before the first dot: {@code acme.buildflow.app} becomes {@code acme}. */
  public static String subdomainPrefix(String domain) {
    String normalized = normalize(domain);
    int dot = normalized.indexOf('.');
    return dot >= 0 ? normalized.substring(0, dot) : normalized;
  }

  /** LIKE pattern matching every domain under the prefix, with wildcards escaped. */
  public static String prefixPattern(String prefix) {
    String escaped = prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    return escaped + ".%";
  }
}
