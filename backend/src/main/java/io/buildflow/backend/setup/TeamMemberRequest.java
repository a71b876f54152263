package io.buildflow.backend.setup;

/** A department head created during setup. Members without name or email are ignored. */
public record TeamMemberRequest(
    String name, String email, String phone, String department, String title) {}
