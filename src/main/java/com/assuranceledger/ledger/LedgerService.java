package com.assuranceledger.ledger;

import com.assuranceledger.common.IdempotencyKey;
import com.assuranceledger.common.exception.AccountNotFoundException;
import com.assuranceledger.common.exception.ConcurrencyConflictException;
import com.assuranceledger.common.exception.InsufficientSecuredFundsException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.InvariantViolationException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The posting primitive of the secured balance ledger.
 *
 * Every change to an account snapshot or to a contract's disbursement totals goes through
 * {@link #post(PostingRequest)}:
 * 1. Lock the contract row (if any), then the account row
 * 2. Return the prior outcome if the idempotency key was already used
 * 3. Validate the monetary invariants against the locked snapshot: {@code 0 <= held <= balance}
 *    on the account and, for contract accounts, {@code released + forfeited + refunded <= committed}
 *    and {@code held <= committed - released - forfeited - refunded}, so held funds can always be
 *    settled when the contract is cancelled
 * 4. Append the entry and its allocations
 * 5. Fold the entry into the account snapshot and the contract totals
 *
 * All steps run in one transaction; a failed check leaves no trace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final AllocationRepository allocationRepository;
    private final SecuredBalanceAccountRepository accountRepository;
    private final CommitmentContractRepository contractRepository;

    @Value("${assurance-ledger.ledger.disbursement-mode:BALANCE_AND_HELD}")
    private DisbursementMode disbursementMode;

    @Transactional
    public PostingResult post(PostingRequest request) {
        validate(request);

        // Lock order is contract before account, everywhere
        String accountContractId = accountRepository.findContractIdByTenantIdAndId(request.getTenantId(), request.getAccountId())
            .orElse(null);
        CommitmentContract contract = null;
        if (accountContractId != null) {
            contract = contractRepository.findByTenantIdAndIdForUpdate(request.getTenantId(), accountContractId)
                .orElseThrow(() -> new NotFoundException("Contract", accountContractId));
            if (request.getContractId() == null) {
                request.setContractId(contract.getId());
            } else if (!request.getContractId().equals(contract.getId())) {
                throw new ValidationException("contractId",
                    "account " + request.getAccountId() + " belongs to contract " + contract.getId());
            }
        }
        SecuredBalanceAccount account = accountRepository.findByTenantIdAndIdForUpdate(request.getTenantId(), request.getAccountId())
            .orElseThrow(() -> new AccountNotFoundException(request.getAccountId()));

        if (request.getIdempotencyKey() != null) {
            Optional<LedgerEntry> existing = ledgerRepository.findByTenantIdAndIdempotencyKey(
                request.getTenantId(), request.getIdempotencyKey());
            if (existing.isPresent()) {
                return replay(request, existing.get());
            }
        }

        LedgerEntry reversed = null;
        LedgerEntry corrected = null;
        long balanceDelta;
        long heldDelta;
        if (request.getEntryType() == EntryType.REVERSAL) {
            reversed = loadReversible(request);
            balanceDelta = -reversed.getBalanceDelta();
            heldDelta = -reversed.getHeldDelta();
        } else if (request.getEntryType() == EntryType.ADJUSTMENT) {
            corrected = loadCorrected(request);
            balanceDelta = request.getBalanceDelta();
            heldDelta = request.getHeldDelta();
        } else {
            balanceDelta = balanceDelta(request.getEntryType(), request.getAmount());
            heldDelta = heldDelta(request.getEntryType(), request.getAmount());
        }

        try {
            if (contract != null) {
                requireWithinBudget(contract, account, request, heldDelta, corrected != null);
            }
            account.requireApplicable(request.getEntryType(), balanceDelta, heldDelta);
        } catch (InvariantViolationException e) {
            log.warn("Rejected {} of {} on account {}: {}", request.getEntryType(), request.getAmount(),
                account.getId(), e.getMessage());
            throw e;
        }

        LedgerEntry entry = new LedgerEntry(request, account.getCurrency(), balanceDelta, heldDelta);
        if (!entry.hasContext()) {
            throw new ValidationException("context", "ledger entry needs at least one context pointer");
        }
        try {
            ledgerRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException(
                "idempotency key " + request.getIdempotencyKey() + " was used by a concurrent posting", e);
        }

        List<SecuredBalanceAllocation> allocations = new ArrayList<>();
        for (AllocationLine line : request.getAllocations()) {
            allocations.add(allocationRepository.save(new SecuredBalanceAllocation(entry, line)));
        }

        account.apply(entry);
        accountRepository.save(account);

        if (contract != null) {
            switch (request.getEntryType()) {
                case RELEASE -> contract.recordRelease(request.getAmount());
                case FORFEIT -> contract.recordForfeit(request.getAmount());
                case REFUND -> contract.recordRefund(request.getAmount());
                case ADJUSTMENT -> {
                    if (corrected != null) {
                        contract.correctDisbursement(corrected.getEntryType(), heldDelta);
                    }
                }
                default -> {
                    // funding, holds and reversals do not touch the committed budget
                }
            }
            contractRepository.save(contract);
        }
        if (corrected != null) {
            account.correctDisbursement(corrected.getEntryType(), heldDelta);
            accountRepository.save(account);
        }

        if (reversed != null) {
            reversed.markReversed();
            ledgerRepository.save(reversed);
        }

        log.info("Posted {}: entry={}, account={}, balanceDelta={}, heldDelta={}, key={}",
            entry.getEntryType(), entry.getId(), account.getId(), balanceDelta, heldDelta, entry.getIdempotencyKey());

        return new PostingResult(entry, allocations, false);
    }

    @Transactional(readOnly = true)
    public AccountReconciliation reconcile(String tenantId, String accountId) {
        SecuredBalanceAccount account = accountRepository.findByTenantIdAndId(tenantId, accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        long foldedBalance = ledgerRepository.sumBalanceDelta(tenantId, accountId, EntryStatus.VOIDED);
        long foldedHeld = ledgerRepository.sumHeldDelta(tenantId, accountId, EntryStatus.VOIDED);
        long entryCount = ledgerRepository.countByTenantIdAndAccountIdAndStatusNot(tenantId, accountId, EntryStatus.VOIDED);
        AccountReconciliation reconciliation = new AccountReconciliation(accountId,
            account.getBalance(), account.getHeld(), foldedBalance, foldedHeld, entryCount);
        if (!reconciliation.isConsistent()) {
            log.error("Account {} snapshot drifted from its ledger: {}", accountId, reconciliation);
        }
        return reconciliation;
    }

    @Transactional(readOnly = true)
    public LedgerEntry getEntry(String tenantId, String entryId) {
        return ledgerRepository.findByTenantIdAndId(tenantId, entryId)
            .orElseThrow(() -> new NotFoundException("Ledger entry", entryId));
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findByIdempotencyKey(String tenantId, String idempotencyKey) {
        return ledgerRepository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAccountLedger(String tenantId, String accountId) {
        return ledgerRepository.findByTenantIdAndAccountIdOrderByOccurredAtAsc(tenantId, accountId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getContractLedger(String tenantId, String contractId) {
        return ledgerRepository.findByTenantIdAndContractIdOrderByOccurredAtAsc(tenantId, contractId);
    }

    @Transactional(readOnly = true)
    public List<SecuredBalanceAllocation> getAllocations(String tenantId, String entryId) {
        return allocationRepository.findByTenantIdAndLedgerEntryId(tenantId, entryId);
    }

    public DisbursementMode getDisbursementMode() {
        return disbursementMode;
    }

    long balanceDelta(EntryType entryType, long amount) {
        return switch (entryType) {
            case FUND -> amount;
            case HOLD -> 0;
            case RELEASE, FORFEIT -> disbursementMode == DisbursementMode.HELD_ONLY ? 0 : -amount;
            case REFUND -> -amount;
            case REVERSAL -> throw new IllegalArgumentException("Reversal deltas come from the reversed entry");
            case ADJUSTMENT -> throw new IllegalArgumentException("Adjustment deltas come from the request");
        };
    }

    long heldDelta(EntryType entryType, long amount) {
        return switch (entryType) {
            case FUND, HOLD -> amount;
            case RELEASE, FORFEIT, REFUND -> -amount;
            case REVERSAL -> throw new IllegalArgumentException("Reversal deltas come from the reversed entry");
            case ADJUSTMENT -> throw new IllegalArgumentException("Adjustment deltas come from the request");
        };
    }

    private void requireWithinBudget(CommitmentContract contract, SecuredBalanceAccount account,
                                     PostingRequest request, long heldDelta, boolean correction) {
        long remaining = contract.getRemainingBudget();
        if (request.getEntryType().isDisbursement()) {
            if (request.getAmount() > remaining) {
                throw new InsufficientSecuredFundsException("released + forfeited + refunded <= committed",
                    "contract " + contract.getId(), request.getAmount(), remaining);
            }
            remaining -= request.getAmount();
        }
        if (correction) {
            remaining += heldDelta;
        }
        long nextHeld = Math.addExact(account.getHeld(), heldDelta);
        if (heldDelta > 0 && nextHeld > remaining) {
            throw new InvariantViolationException("held <= committed - released - forfeited - refunded",
                String.format("account %s would hold %d but contract %s can only disburse %d more",
                    account.getId(), nextHeld, contract.getId(), remaining));
        }
    }

    private PostingResult replay(PostingRequest request, LedgerEntry existing) {
        if (!existing.getAccountId().equals(request.getAccountId())
            || existing.getEntryType() != request.getEntryType()) {
            throw new ValidationException("idempotencyKey",
                "key " + request.getIdempotencyKey() + " was already used for a different posting");
        }
        log.info("Duplicate {} posting with idempotency key {}", request.getEntryType(), request.getIdempotencyKey());
        return new PostingResult(existing, allocationRepository.findByTenantIdAndLedgerEntryId(
            existing.getTenantId(), existing.getId()), true);
    }

    private LedgerEntry loadReversible(PostingRequest request) {
        if (request.getReversesEntryId() == null) {
            throw new ValidationException("reversesEntryId", "is required for a reversal");
        }
        LedgerEntry original = ledgerRepository.findByTenantIdAndId(request.getTenantId(), request.getReversesEntryId())
            .orElseThrow(() -> new NotFoundException("Ledger entry", request.getReversesEntryId()));
        if (!original.getAccountId().equals(request.getAccountId())) {
            throw new ValidationException("reversesEntryId", "entry belongs to another account");
        }
        if (original.getEntryType() != EntryType.FUND) {
            throw new InvalidStateException("ledger entry", original.getId(), original.getEntryType().name(), "reverse",
                "only funding entries can be reversed; disbursements are corrected through claims");
        }
        if (original.getStatus() != EntryStatus.POSTED) {
            throw new InvalidStateException("ledger entry", original.getId(), original.getStatus().name(), "reverse");
        }
        request.setAmount(original.getAmount());
        return original;
    }

    private LedgerEntry loadCorrected(PostingRequest request) {
        if (request.getReversesEntryId() == null) {
            return null;
        }
        LedgerEntry original = ledgerRepository.findByTenantIdAndId(request.getTenantId(), request.getReversesEntryId())
            .orElseThrow(() -> new NotFoundException("Ledger entry", request.getReversesEntryId()));
        if (!original.getAccountId().equals(request.getAccountId())) {
            throw new ValidationException("reversesEntryId", "entry belongs to another account");
        }
        if (!original.getEntryType().isDisbursement()) {
            throw new InvalidStateException("ledger entry", original.getId(), original.getEntryType().name(),
                "correct", "only releases, forfeits and refunds can be corrected by an adjustment");
        }
        if (request.getHeldDelta() <= 0) {
            throw new ValidationException("heldDelta",
                "a correction must restore held funds, got " + request.getHeldDelta());
        }
        long alreadyCorrected = ledgerRepository.sumHeldDeltaReferencing(request.getTenantId(), original.getId(),
            EntryType.ADJUSTMENT);
        long correctable = original.getAmount() - alreadyCorrected;
        if (request.getHeldDelta() > correctable) {
            throw new ValidationException("heldDelta", String.format(
                "entry %s has %d left to correct, got %d", original.getId(), correctable, request.getHeldDelta()));
        }
        return original;
    }

    private void validate(PostingRequest request) {
        if (request.getTenantId() == null || request.getAccountId() == null) {
            throw new ValidationException("posting", "tenantId and accountId are required");
        }
        if (request.getEntryType() == null) {
            throw new ValidationException("entryType", "is required");
        }
        if (request.getIdempotencyKey() != null) {
            IdempotencyKey.validate(request.getIdempotencyKey());
        }
        if (request.getEntryType().hasCallerDeltas()) {
            if (request.getBalanceDelta() == 0 && request.getHeldDelta() == 0) {
                throw new ValidationException("delta", "an adjustment needs a non-zero balance or held delta");
            }
            if (request.getReasonCode() == null || request.getReasonCode().isBlank()) {
                throw new ValidationException("reasonCode", "is required for an adjustment");
            }
            request.setAmount(request.getHeldDelta() != 0
                ? Math.abs(request.getHeldDelta()) : Math.abs(request.getBalanceDelta()));
        } else if (request.getEntryType() != EntryType.REVERSAL && request.getAmount() <= 0) {
            throw new ValidationException("amount", "must be > 0, got " + request.getAmount());
        }
        long allocated = 0;
        for (AllocationLine line : request.getAllocations()) {
            line.validate();
            allocated += line.getAmount();
        }
        if (!request.getAllocations().isEmpty() && request.getEntryType() != EntryType.REVERSAL
            && allocated != request.getAmount()) {
            throw new ValidationException("allocations",
                String.format("allocated %d does not match posted amount %d", allocated, request.getAmount()));
        }
    }
}
