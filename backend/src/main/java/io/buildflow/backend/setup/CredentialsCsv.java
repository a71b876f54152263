package io.buildflow.backend.setup;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Renders issued credentials as the CSV handed to the agency owner. */
final class CredentialsCsv {

  static final String HEADER = "Name,Email,Role,Department,Employee ID,Temporary Password";

  private CredentialsCsv() {}

  static String render(List<TeamMemberCredential> credentials) {
    Stream<String> rows =
        credentials.stream()
            .map(
                c ->
                    Stream.of(
                            c.name(),
                            c.email(),
                            c.role(),
                            c.department(),
                            c.employeeId(),
                            c.temporaryPassword())
                        .map(CredentialsCsv::escape)
                        .collect(Collectors.joining(",")));
    return Stream.concat(Stream.of(HEADER), rows).collect(Collectors.joining("\n"));
  }

  static String escape(String value) {
    if (value == null) {
      return "";
    }
    if (value.contains("\"") || value.contains(",") || value.contains("\n")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
