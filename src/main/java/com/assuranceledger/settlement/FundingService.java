package com.assuranceledger.settlement;

import com.assuranceledger.common.IdempotencyKey;
import com.assuranceledger.common.Money;
import com.assuranceledger.common.exception.AccountNotFoundException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.ledger.LedgerEntry;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.PostingRequest;
import com.assuranceledger.ledger.PostingResult;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.ledger.SecuredBalanceAccountRepository;
import com.assuranceledger.milestones.MilestoneEvaluator;
import com.assuranceledger.subjects.SubjectRef;
import com.assuranceledger.subjects.SubjectRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records money received from, or clawed back by, the external funding source.
 *
 * The core never moves money on external rails; it records that the movement happened and
 * re-evaluates the contract so automatic releases blocked on funds can go ahead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundingService {

    private final LedgerService ledgerService;
    private final SecuredBalanceAccountRepository accountRepository;
    private final CommitmentContractRepository contractRepository;
    private final MilestoneEvaluator milestoneEvaluator;
    private final SubjectRegistry subjectRegistry;

    @Transactional
    public PostingResult fund(FundingRequest request) {
        IdempotencyKey.validate(request.getIdempotencyKey());
        Money.requirePositive(request.getAmount(), "amount");
        SubjectRef source = subjectRegistry.requireIfPresent(request.getTenantId(), "sourceSubject",
            request.getSourceSubject());

        CommitmentContract contract = lockContractOf(request.getTenantId(), request.getAccountId());
        if (contract != null && contract.isTerminal()) {
            throw new InvalidStateException("contract", contract.getId(), contract.getStatus().name(), "fund");
        }
        SecuredBalanceAccount account = accountRepository
            .findByTenantIdAndIdForUpdate(request.getTenantId(), request.getAccountId())
            .orElseThrow(() -> new AccountNotFoundException(request.getAccountId()));
        if (request.getCurrency() != null && !request.getCurrency().equals(account.getCurrency())) {
            throw new ValidationException("currency", String.format("account %s is in %s, funding was in %s",
                account.getId(), account.getCurrency(), request.getCurrency()));
        }

        log.info("Processing funding of {} on account {}", Money.of(request.getAmount(), account.getCurrency()),
            account.getId());

        PostingResult result = ledgerService.post(PostingRequest.builder()
            .tenantId(request.getTenantId())
            .accountId(account.getId())
            .entryType(EntryType.FUND)
            .amount(request.getAmount())
            .externalTransactionId(request.getExternalTransactionId())
            .sourceSubject(source)
            .idempotencyKey(request.getIdempotencyKey())
            .reasonCode("funding")
            .notes(request.getNotes())
            .build());

        if (contract != null && !result.isReplayed()) {
            milestoneEvaluator.evaluateContract(contract.getTenantId(), contract.getId());
        }
        return result;
    }

    /**
     * Reverse a funding entry in full, e.g. after a chargeback. Fails with insufficient funds
     * when the reversed money has already been released.
     */
    @Transactional
    public PostingResult reverseFunding(FundingReversalRequest request) {
        IdempotencyKey.validate(request.getIdempotencyKey());
        if (request.getFundingEntryId() == null) {
            throw new ValidationException("fundingEntryId", "is required");
        }

        lockContractOf(request.getTenantId(), request.getAccountId());
        LedgerEntry funding = ledgerService.getEntry(request.getTenantId(), request.getFundingEntryId());

        log.info("Reversing funding entry {} on account {}", funding.getId(), request.getAccountId());

        return ledgerService.post(PostingRequest.builder()
            .tenantId(request.getTenantId())
            .accountId(request.getAccountId())
            .entryType(EntryType.REVERSAL)
            .reversesEntryId(funding.getId())
            .externalTransactionId(funding.getExternalTransactionId())
            .sourceSubject(funding.getSourceSubject())
            .idempotencyKey(request.getIdempotencyKey())
            .reasonCode(request.getReasonCode() != null ? request.getReasonCode() : "chargeback")
            .notes(request.getNotes())
            .build());
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
