package io.buildflow.backend.provisioning;

import io.buildflow.backend.provisioning.CreateTenantCommand.OnboardingMetadata;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/** Entitles a new agency to pages of the central page catalog. */
@Service
public class PageEntitlementService {

  private static final Logger log = LoggerFactory.getLogger(PageEntitlementService.class);

  private final JdbcTemplate jdbcTemplate;

  public PageEntitlementService(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Assigns the requested pages plus recommendations derived from the onboarding answers, or every
   * active page when that yields nothing. Inactive or unknown page ids are ignored.
   *
   * @return number of pages assigned
   */
  public int assignDefaults(
      UUID agencyId, List<UUID> requestedPageIds, OnboardingMetadata metadata) {
    Set<UUID> pageIds = new LinkedHashSet<>(requestedPageIds);
    if (!metadata.businessGoals().isEmpty() || metadata.primaryFocus() != null) {
      pageIds.addAll(recommendedPages(metadata.primaryFocus()));
    }
    if (pageIds.isEmpty()) {
      pageIds.addAll(
          jdbcTemplate.queryForList(
              "SELECT id FROM public.page_catalog WHERE is_active = true", UUID.class));
    }

    List<Object[]> batch = new ArrayList<>();
    for (UUID pageId : pageIds) {
      batch.add(new Object[] {agencyId, pageId});
    }
    int[] counts =
        jdbcTemplate.batchUpdate(
            """
            INSERT INTO public.agency_page_assignments (agency_id, page_id, status, assigned_by)
            SELECT ?, id, 'active', NULL FROM public.page_catalog
            WHERE id = ? AND is_active = true
            ON CONFLICT (agency_id, page_id) DO UPDATE SET status = 'active', assigned_at = now()
            """,
            batch);
    int assigned = 0;
    for (int count : counts) {
      assigned += Math.max(count, 0);
    }
    log.info("Assigned {} pages to agency {}", assigned, agencyId);
    return assigned;
  }

  private List<UUID> recommendedPages(String primaryFocus) {
    return jdbcTemplate.queryForList(
        """
        SELECT id FROM public.page_catalog
        WHERE is_active = true AND (is_recommended = true OR category = ?)
        """,
        UUID.class,
        primaryFocus);
  }
}
