package io.buildflow.backend.provisioning;

public record PostalAddress(
    String street, String city, String state, String zip, String country) {

  public static PostalAddress empty() {
    return new PostalAddress(null, null, null, null, null);
  }
}
