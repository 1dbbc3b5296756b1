package com.assuranceledger.ledger;

import com.assuranceledger.common.exception.InsufficientSecuredFundsException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.InvariantViolationException;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Money bucket tied to zero or one commitment contract.
 *
 * {@code balance}, {@code held}, {@code released}, {@code forfeited} and {@code refunded} are a
 * materialized cache of the account's ledger entries. They have no setters: the only mutator is
 * {@link #apply(LedgerEntry)}, which {@link LedgerService} calls in the transaction that appends
 * the entry.
 */
@Entity
@Table(name = "secured_balance_accounts",
    uniqueConstraints = @UniqueConstraint(name = "uk_account_contract", columnNames = {"tenant_id", "contract_id"}),
    indexes = @Index(name = "idx_account_owner", columnList = "tenant_id, owner_subject_kind, owner_subject_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SecuredBalanceAccount {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "contract_id", updatable = false)
    private String contractId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AccountType accountType;

    private String customTypeCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AccountStatus status;

    @Column(length = 3, nullable = false)
    private String currency;

    private long balance;

    private long held;

    private long released;

    private long forfeited;

    private long refunded;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "owner_subject_kind", nullable = false)),
        @AttributeOverride(name = "id", column = @Column(name = "owner_subject_id", nullable = false))
    })
    private SubjectRef ownerSubject;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "counterparty_subject_kind")),
        @AttributeOverride(name = "id", column = @Column(name = "counterparty_subject_id"))
    })
    private SubjectRef counterpartySubject;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    private Instant closedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    SecuredBalanceAccount(String tenantId, String contractId, AccountType accountType, String customTypeCode,
                          String currency, SubjectRef ownerSubject, SubjectRef counterpartySubject) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.contractId = contractId;
        this.accountType = accountType;
        this.customTypeCode = customTypeCode;
        this.currency = currency;
        this.ownerSubject = ownerSubject;
        this.counterpartySubject = counterpartySubject;
        this.status = AccountStatus.OPEN;
        this.openedAt = Instant.now();
        this.updatedAt = this.openedAt;
    }

    public boolean isOpen() {
        return status == AccountStatus.OPEN;
    }

    /**
     * Check that applying the deltas keeps {@code 0 <= held <= balance}, without changing anything.
     */
    void requireApplicable(EntryType entryType, long balanceDelta, long heldDelta) {
        if (!isOpen()) {
            throw new InvalidStateException("account", id, status.name(), "post " + entryType);
        }
        long nextBalance = Math.addExact(balance, balanceDelta);
        long nextHeld = Math.addExact(held, heldDelta);
        if (nextHeld < 0) {
            throw new InsufficientSecuredFundsException("held >= 0", "account " + id, -heldDelta, held);
        }
        if (nextBalance < 0) {
            throw new InsufficientSecuredFundsException("balance >= 0", "account " + id, -balanceDelta, balance);
        }
        if (nextHeld > nextBalance) {
            throw new InvariantViolationException("held <= balance",
                String.format("account %s would hold %d of a %d balance", id, nextHeld, nextBalance));
        }
    }

    /**
     * Fold one freshly appended entry into the snapshot.
     */
    void apply(LedgerEntry entry) {
        if (!id.equals(entry.getAccountId())) {
            throw new InvariantViolationException("entry.account == account",
                "entry " + entry.getId() + " belongs to account " + entry.getAccountId());
        }
        requireApplicable(entry.getEntryType(), entry.getBalanceDelta(), entry.getHeldDelta());
        balance += entry.getBalanceDelta();
        held += entry.getHeldDelta();
        long amount = Math.abs(entry.getHeldDelta());
        switch (entry.getEntryType()) {
            case RELEASE -> released += amount;
            case FORFEIT -> forfeited += amount;
            case REFUND -> refunded += amount;
            default -> {
                // the other types only move balance/held
            }
        }
        updatedAt = Instant.now();
    }

    /**
     * Take an adjusted amount back out of the disbursement total it was counted in.
     */
    void correctDisbursement(EntryType disbursement, long amount) {
        switch (disbursement) {
            case RELEASE -> released = lowered(released, amount, "released");
            case FORFEIT -> forfeited = lowered(forfeited, amount, "forfeited");
            case REFUND -> refunded = lowered(refunded, amount, "refunded");
            default -> throw new IllegalArgumentException(disbursement + " is not a disbursement");
        }
        updatedAt = Instant.now();
    }

    private long lowered(long total, long amount, String name) {
        if (amount > total) {
            throw new InvariantViolationException(name + " >= 0",
                String.format("account %s cannot correct %d of a %s total of %d", id, amount, name, total));
        }
        return total - amount;
    }

    void close() {
        if (!isOpen()) {
            throw new InvalidStateException("account", id, status.name(), "close");
        }
        if (held != 0) {
            throw new InvalidStateException("account", id, status.name(), "close",
                "account still holds " + held);
        }
        status = AccountStatus.CLOSED;
        closedAt = Instant.now();
        updatedAt = closedAt;
    }
}
