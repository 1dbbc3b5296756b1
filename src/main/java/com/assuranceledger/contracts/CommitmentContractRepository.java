package com.assuranceledger.contracts;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for commitment contract persistence.
 */
@Repository
public interface CommitmentContractRepository extends JpaRepository<CommitmentContract, String> {

    Optional<CommitmentContract> findByTenantIdAndId(String tenantId, String id);

    /**
     * Row lock serializing every contract-level mutation, including milestone evaluation.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CommitmentContract c WHERE c.tenantId = :tenantId AND c.id = :id")
    Optional<CommitmentContract> findByTenantIdAndIdForUpdate(@Param("tenantId") String tenantId,
                                                              @Param("id") String id);

    List<CommitmentContract> findByTenantIdAndStatus(String tenantId, ContractStatus status);

    List<CommitmentContract> findByStatusInAndExpiresAtBefore(Collection<ContractStatus> statuses, Instant cutoff);
}
