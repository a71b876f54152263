package io.buildflow.backend.setup;

import java.util.List;

public record TeamCredentialsManifest(
    List<TeamMemberCredential> credentials,
    List<String> skippedEmails,
    List<String> failedEmails,
    String csv) {}
