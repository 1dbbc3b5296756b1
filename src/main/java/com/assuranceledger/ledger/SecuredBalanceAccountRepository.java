package com.assuranceledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for secured balance account persistence.
 */
@Repository
public interface SecuredBalanceAccountRepository extends JpaRepository<SecuredBalanceAccount, String> {

    Optional<SecuredBalanceAccount> findByTenantIdAndId(String tenantId, String id);

    Optional<SecuredBalanceAccount> findByTenantIdAndContractId(String tenantId, String contractId);

    /**
     * Contract of an account, read without loading the entity so the contract can be locked first.
     */
    @Query("SELECT a.contractId FROM SecuredBalanceAccount a WHERE a.tenantId = :tenantId AND a.id = :id")
    Optional<String> findContractIdByTenantIdAndId(@Param("tenantId") String tenantId, @Param("id") String id);

    /**
     * Row lock taken by every posting, after the owning contract's lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM SecuredBalanceAccount a WHERE a.tenantId = :tenantId AND a.id = :id")
    Optional<SecuredBalanceAccount> findByTenantIdAndIdForUpdate(@Param("tenantId") String tenantId,
                                                                 @Param("id") String id);

    @Query("SELECT a FROM SecuredBalanceAccount a WHERE a.tenantId = :tenantId "
        + "AND a.ownerSubject.kind = :kind AND a.ownerSubject.id = :subjectId ORDER BY a.openedAt")
    List<SecuredBalanceAccount> findByOwner(@Param("tenantId") String tenantId, @Param("kind") String kind,
                                            @Param("subjectId") String subjectId);
}
