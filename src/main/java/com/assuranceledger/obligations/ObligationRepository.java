package com.assuranceledger.obligations;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for obligation persistence.
 */
@Repository
public interface ObligationRepository extends JpaRepository<Obligation, String> {

    Optional<Obligation> findByTenantIdAndId(String tenantId, String id);

    @Query("SELECT o.contractId FROM Obligation o WHERE o.tenantId = :tenantId AND o.id = :id")
    Optional<String> findContractIdByTenantIdAndId(@Param("tenantId") String tenantId, @Param("id") String id);

    List<Obligation> findByTenantIdAndContractIdOrderBySortOrderAsc(String tenantId, String contractId);

    List<Obligation> findByTenantIdAndContractIdAndStatusIn(String tenantId, String contractId,
                                                            Collection<ObligationStatus> statuses);

    long countByTenantIdAndContractIdAndStatusIn(String tenantId, String contractId,
                                                 Collection<ObligationStatus> statuses);

    List<Obligation> findByTenantIdAndIdIn(String tenantId, Collection<String> ids);

    List<Obligation> findByStatusInAndDueAtBefore(Collection<ObligationStatus> statuses, Instant cutoff);
}
