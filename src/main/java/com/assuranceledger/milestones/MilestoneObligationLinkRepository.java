package com.assuranceledger.milestones;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for milestone-obligation links.
 */
@Repository
public interface MilestoneObligationLinkRepository extends JpaRepository<MilestoneObligationLink, String> {

    List<MilestoneObligationLink> findByTenantIdAndMilestoneIdOrderBySortOrderAsc(String tenantId, String milestoneId);

    List<MilestoneObligationLink> findByTenantIdAndObligationId(String tenantId, String obligationId);

    boolean existsByTenantIdAndMilestoneIdAndObligationId(String tenantId, String milestoneId, String obligationId);
}
