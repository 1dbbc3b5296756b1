package com.assuranceledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for secured balance ledger entries.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntry, String> {

    Optional<LedgerEntry> findByTenantIdAndId(String tenantId, String id);

    Optional<LedgerEntry> findByTenantIdAndIdempotencyKey(String tenantId, String idempotencyKey);

    List<LedgerEntry> findByTenantIdAndAccountIdOrderByOccurredAtAsc(String tenantId, String accountId);

    List<LedgerEntry> findByTenantIdAndContractIdOrderByOccurredAtAsc(String tenantId, String contractId);

    List<LedgerEntry> findByTenantIdAndMilestoneId(String tenantId, String milestoneId);

    @Query("SELECT COALESCE(SUM(e.balanceDelta), 0) FROM LedgerEntry e "
        + "WHERE e.tenantId = :tenantId AND e.accountId = :accountId AND e.status <> :excluded")
    long sumBalanceDelta(@Param("tenantId") String tenantId, @Param("accountId") String accountId,
                         @Param("excluded") EntryStatus excluded);

    @Query("SELECT COALESCE(SUM(e.heldDelta), 0) FROM LedgerEntry e "
        + "WHERE e.tenantId = :tenantId AND e.accountId = :accountId AND e.status <> :excluded")
    long sumHeldDelta(@Param("tenantId") String tenantId, @Param("accountId") String accountId,
                      @Param("excluded") EntryStatus excluded);

    @Query("SELECT COALESCE(SUM(e.heldDelta), 0) FROM LedgerEntry e "
        + "WHERE e.tenantId = :tenantId AND e.reversesEntryId = :entryId AND e.entryType = :entryType")
    long sumHeldDeltaReferencing(@Param("tenantId") String tenantId, @Param("entryId") String entryId,
                                 @Param("entryType") EntryType entryType);

    long countByTenantIdAndAccountIdAndStatusNot(String tenantId, String accountId, EntryStatus excluded);
}
