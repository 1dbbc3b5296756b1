package com.assuranceledger.claims;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the append-only claim timeline.
 */
@Repository
public interface ClaimEventRepository extends JpaRepository<ClaimEvent, String> {

    List<ClaimEvent> findByTenantIdAndClaimIdOrderByOccurredAtAsc(String tenantId, String claimId);
}
