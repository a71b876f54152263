package io.buildflow.backend.setup;

import java.util.UUID;

/** Login issued to a team member; {@code temporaryPassword} is only ever returned once. */
public record TeamMemberCredential(
    UUID userId,
    String name,
    String email,
    String role,
    String department,
    String employeeId,
    String temporaryPassword) {}
