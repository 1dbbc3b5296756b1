package com.assuranceledger.milestones;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for milestone persistence.
 */
@Repository
public interface MilestoneRepository extends JpaRepository<Milestone, String> {

    Optional<Milestone> findByTenantIdAndId(String tenantId, String id);

    /**
     * Contract of a milestone, read without loading the entity so the contract can be locked first.
     */
    @Query("SELECT m.contractId FROM Milestone m WHERE m.tenantId = :tenantId AND m.id = :id")
    Optional<String> findContractIdByTenantIdAndId(@Param("tenantId") String tenantId, @Param("id") String id);

    List<Milestone> findByTenantIdAndContractIdOrderBySortOrderAsc(String tenantId, String contractId);

    List<Milestone> findByTenantIdAndContractIdAndStatusInOrderBySortOrderAsc(String tenantId, String contractId,
                                                                               Collection<MilestoneStatus> statuses);

    List<Milestone> findByTenantIdAndIdInAndStatusIn(String tenantId, Collection<String> ids,
                                                     Collection<MilestoneStatus> statuses);

    boolean existsByTenantIdAndContractIdAndCode(String tenantId, String contractId, String code);
}
