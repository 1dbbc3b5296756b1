package com.assuranceledger.settlement;

import com.assuranceledger.common.IdempotencyKey;
import com.assuranceledger.common.Money;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.PostingRequest;
import com.assuranceledger.ledger.PostingResult;
import com.assuranceledger.ledger.SecuredBalanceAccountRepository;
import com.assuranceledger.milestones.MilestoneEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operator holds and corrections on secured balance accounts.
 *
 * Entries are never edited: a mistaken posting is corrected by a new {@link EntryType#ADJUSTMENT}
 * that goes through the same invariant checks as every other posting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdjustmentService {

    private final LedgerService ledgerService;
    private final SecuredBalanceAccountRepository accountRepository;
    private final CommitmentContractRepository contractRepository;
    private final MilestoneEvaluator milestoneEvaluator;

    @Transactional
    public PostingResult hold(HoldRequest request) {
        IdempotencyKey.validate(request.getIdempotencyKey());
        Money.requirePositive(request.getAmount(), "amount");
        CommitmentContract contract = lockContractOf(request.getTenantId(), request.getAccountId());
        requireNotTerminal(contract, "hold");

        log.info("Holding {} of available balance on account {}", request.getAmount(), request.getAccountId());

        PostingResult result = ledgerService.post(PostingRequest.builder()
            .tenantId(request.getTenantId())
            .accountId(request.getAccountId())
            .entryType(EntryType.HOLD)
            .amount(request.getAmount())
            .idempotencyKey(request.getIdempotencyKey())
            .reasonCode(request.getReasonCode() != null ? request.getReasonCode() : "hold")
            .notes(request.getNotes())
            .build());

        reevaluate(contract, result);
        return result;
    }

    /**
     * Post a correction. On a completed, cancelled or defaulted contract only decreases of held
     * are accepted, since nothing could settle newly held funds there.
     */
    @Transactional
    public PostingResult adjust(AdjustmentRequest request) {
        IdempotencyKey.validate(request.getIdempotencyKey());
        CommitmentContract contract = lockContractOf(request.getTenantId(), request.getAccountId());
        if (request.getHeldDelta() > 0) {
            requireNotTerminal(contract, "adjust");
        }

        log.info("Adjusting account {} by balance={}, held={} ({}) for {}", request.getAccountId(),
            request.getBalanceDelta(), request.getHeldDelta(), request.getReasonCode(), request.getActor());

        PostingResult result = ledgerService.post(PostingRequest.builder()
            .tenantId(request.getTenantId())
            .accountId(request.getAccountId())
            .entryType(EntryType.ADJUSTMENT)
            .balanceDelta(request.getBalanceDelta())
            .heldDelta(request.getHeldDelta())
            .reversesEntryId(request.getCorrectsEntryId())
            .externalTransactionId(request.getExternalReference())
            .idempotencyKey(request.getIdempotencyKey())
            .reasonCode(request.getReasonCode())
            .notes(request.getNotes())
            .build());

        reevaluate(contract, result);
        return result;
    }

    private void reevaluate(CommitmentContract contract, PostingResult result) {
        if (contract != null && !result.isReplayed() && result.getEntry().getHeldDelta() > 0) {
            milestoneEvaluator.evaluateContract(contract.getTenantId(), contract.getId());
        }
    }

    private void requireNotTerminal(CommitmentContract contract, String operation) {
        if (contract != null && contract.isTerminal()) {
            throw new InvalidStateException("contract", contract.getId(), contract.getStatus().name(), operation);
        }
    }

    private CommitmentContract lockContractOf(String tenantId, String accountId) {
        String contractId = accountRepository.findContractIdByTenantIdAndId(tenantId, accountId).orElse(null);
        if (contractId == null) {
            return null;
        }
        return contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
    }
}
