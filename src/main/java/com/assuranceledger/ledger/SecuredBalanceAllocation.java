package com.assuranceledger.ledger;

import com.assuranceledger.subjects.SubjectRef;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Explains which obligation, milestone, external line or subject part of a ledger entry was applied to.
 */
@Entity
@Table(name = "secured_balance_allocations", indexes = {
    @Index(name = "idx_allocation_entry", columnList = "tenant_id, ledger_entry_id"),
    @Index(name = "idx_allocation_obligation", columnList = "tenant_id, obligation_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SecuredBalanceAllocation {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "ledger_entry_id", nullable = false, updatable = false)
    private String ledgerEntryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AllocationType allocationType;

    @Column(nullable = false, updatable = false)
    private long allocatedAmount;

    @Column(length = 3, nullable = false, updatable = false)
    private String currency;

    @Column(name = "obligation_id", updatable = false)
    private String obligationId;

    @Column(updatable = false)
    private String milestoneId;

    @Column(updatable = false)
    private String externalLineId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "target_subject_kind", updatable = false)),
        @AttributeOverride(name = "id", column = @Column(name = "target_subject_id", updatable = false))
    })
    private SubjectRef targetSubject;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    SecuredBalanceAllocation(LedgerEntry entry, AllocationLine line) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = entry.getTenantId();
        this.ledgerEntryId = entry.getId();
        this.allocationType = line.getAllocationType();
        this.allocatedAmount = line.getAmount();
        this.currency = entry.getCurrency();
        this.obligationId = line.getObligationId();
        this.milestoneId = line.getMilestoneId();
        this.externalLineId = line.getExternalLineId();
        this.targetSubject = line.getTargetSubject();
        this.occurredAt = entry.getOccurredAt();
    }
}
