package io.buildflow.backend.provisioning;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AgencyRepository extends JpaRepository<Agency, UUID> {

  Optional<Agency> findByDatabaseName(String databaseName);

  boolean existsByDatabaseNameAndActiveTrue(String databaseName);

  List<Agency> findAllByActiveTrue();

  /** Oldest agency whose domain is the given domain, the bare prefix, or any host under it. */
  @Query(
      value =
          "SELECT * FROM public.agencies"
              + " WHERE domain = :domain OR domain = :prefix OR domain LIKE :pattern"
              + " ORDER BY created_at ASC LIMIT 1",
      nativeQuery = true)
  Optional<Agency> findOldestMatchingDomain(
      @Param("domain") String domain,
      @Param("prefix") String prefix,
      @Param("pattern") String pattern);
}
