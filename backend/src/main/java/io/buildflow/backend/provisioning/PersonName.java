package io.buildflow.backend.provisioning;

/** First and last name split from a full name; a single word is used for both. */
record PersonName(String first, String last) {

  static PersonName split(String fullName) {
    String trimmed = fullName == null ? "" : fullName.trim();
    if (trimmed.isEmpty()) {
      return new PersonName("", "");
    }
    String[] parts = trimmed.split("\\s+", 2);
    return parts.length == 1
        ? new PersonName(parts[0], parts[0])
        : new PersonName(parts[0], parts[1]);
  }
}
