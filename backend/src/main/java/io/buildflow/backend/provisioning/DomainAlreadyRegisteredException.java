package io.buildflow.backend.provisioning;

/** The agency registry already holds this domain; raised by the domain unique constraint. */
class DomainAlreadyRegisteredException extends RuntimeException {

  private final String domain;

  DomainAlreadyRegisteredException(String domain, Throwable cause) {
    super("Domain already registered: " + domain, cause);
    this.domain = domain;
  }

  String getDomain() {
    return domain;
  }
}
