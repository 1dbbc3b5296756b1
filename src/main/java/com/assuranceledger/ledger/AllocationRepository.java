package com.assuranceledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for secured balance allocations.
 */
@Repository
public interface AllocationRepository extends JpaRepository<SecuredBalanceAllocation, String> {

    List<SecuredBalanceAllocation> findByTenantIdAndLedgerEntryId(String tenantId, String ledgerEntryId);

    List<SecuredBalanceAllocation> findByTenantIdAndObligationId(String tenantId, String obligationId);

    List<SecuredBalanceAllocation> findByTenantIdAndMilestoneId(String tenantId, String milestoneId);
}
