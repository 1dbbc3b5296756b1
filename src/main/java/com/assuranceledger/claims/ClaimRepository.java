package com.assuranceledger.claims;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for claim persistence.
 */
@Repository
public interface ClaimRepository extends JpaRepository<Claim, String> {

    Optional<Claim> findByTenantIdAndId(String tenantId, String id);

    @Query("SELECT c.contractId FROM Claim c WHERE c.tenantId = :tenantId AND c.id = :id")
    Optional<String> findContractIdByTenantIdAndId(@Param("tenantId") String tenantId, @Param("id") String id);

    List<Claim> findByTenantIdAndContractIdOrderByOpenedAtAsc(String tenantId, String contractId);

    List<Claim> findByTenantIdAndContractIdAndStatusIn(String tenantId, String contractId,
                                                       Collection<ClaimStatus> statuses);

    long countByTenantIdAndContractIdAndStatusIn(String tenantId, String contractId,
                                                 Collection<ClaimStatus> statuses);
}
