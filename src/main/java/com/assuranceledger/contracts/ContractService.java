package com.assuranceledger.contracts;

import com.assuranceledger.claims.ClaimRepository;
import com.assuranceledger.claims.ClaimStatus;
import com.assuranceledger.common.IdempotencyKey;
import com.assuranceledger.common.Money;
import com.assuranceledger.common.TypeCodes;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.ledger.AllocationLine;
import com.assuranceledger.ledger.AllocationType;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.PostingRequest;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.ledger.SecuredBalanceAccountRepository;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.MilestoneEvaluator;
import com.assuranceledger.milestones.MilestoneRepository;
import com.assuranceledger.milestones.MilestoneStatus;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationRepository;
import com.assuranceledger.obligations.ObligationStatus;
import com.assuranceledger.subjects.SubjectRef;
import com.assuranceledger.subjects.SubjectRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for commitment contract lifecycle.
 *
 * Every mutation takes the contract row lock first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private static final List<ObligationStatus> OPEN_OBLIGATIONS =
        List.of(ObligationStatus.PENDING, ObligationStatus.IN_PROGRESS);
    private static final List<MilestoneStatus> UNRELEASED_MILESTONES =
        List.of(MilestoneStatus.PENDING, MilestoneStatus.READY);

    private final CommitmentContractRepository contractRepository;
    private final ObligationRepository obligationRepository;
    private final MilestoneRepository milestoneRepository;
    private final ClaimRepository claimRepository;
    private final SecuredBalanceAccountRepository accountRepository;
    private final LedgerService ledgerService;
    private final MilestoneEvaluator milestoneEvaluator;
    private final SubjectRegistry subjectRegistry;

    @Value("${assurance-ledger.contracts.default-cancellation-policy:FORFEIT_HELD}")
    private CancellationPolicy defaultCancellationPolicy;

    @Value("${assurance-ledger.claims.default-freeze-policy:FREEZE_ALL}")
    private ClaimFreezePolicy defaultFreezePolicy;

    @Transactional
    public CommitmentContract create(CreateContractCommand command) {
        String customTypeCode = TypeCodes.requireCustomCode("contractType", command.getContractType(),
            command.getCustomTypeCode());
        Money.requireCurrency(command.getCurrency());
        Money.requireNonNegative(command.getCommittedAmount(), "committedAmount");
        SubjectRef anchor = subjectRegistry.require(command.getTenantId(), "anchorSubject",
            command.getAnchorSubject());
        SubjectRef counterparty = subjectRegistry.requireIfPresent(command.getTenantId(), "counterpartySubject",
            command.getCounterpartySubject());

        CommitmentContract contract = new CommitmentContract(
            command.getTenantId(),
            command.getContractType(),
            customTypeCode,
            command.getTitle(),
            anchor,
            counterparty,
            command.getCurrency(),
            command.getCommittedAmount(),
            command.getStartedAt(),
            command.getExpiresAt(),
            command.getCancellationPolicy() != null ? command.getCancellationPolicy() : defaultCancellationPolicy,
            command.getClaimFreezePolicy() != null ? command.getClaimFreezePolicy() : defaultFreezePolicy
        );
        contract = contractRepository.save(contract);

        log.info("Created {} contract {} committing {} for {}", contract.getContractType(), contract.getId(),
            Money.of(contract.getCommittedAmount(), contract.getCurrency()), anchor);

        return contract;
    }

    @Transactional(readOnly = true)
    public CommitmentContract get(String tenantId, String contractId) {
        return contractRepository.findByTenantIdAndId(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
    }

    @Transactional(readOnly = true)
    public List<CommitmentContract> listByStatus(String tenantId, ContractStatus status) {
        return contractRepository.findByTenantIdAndStatus(tenantId, status);
    }

    /**
     * Activate a draft contract and evaluate milestones whose obligations were already settled.
     */
    @Transactional
    public CommitmentContract activate(String tenantId, String contractId) {
        CommitmentContract contract = lock(tenantId, contractId);
        contract.activate();
        contractRepository.save(contract);
        log.info("Activated contract {}", contractId);

        milestoneEvaluator.evaluateContract(tenantId, contractId);
        return contract;
    }

    @Transactional
    public CommitmentContract pause(String tenantId, String contractId) {
        CommitmentContract contract = lock(tenantId, contractId);
        contract.pause();
        log.info("Paused contract {}", contractId);
        return contractRepository.save(contract);
    }

    @Transactional
    public CommitmentContract resume(String tenantId, String contractId) {
        CommitmentContract contract = lock(tenantId, contractId);
        contract.resume();
        contractRepository.save(contract);
        log.info("Resumed contract {}", contractId);

        milestoneEvaluator.evaluateContract(tenantId, contractId);
        return contract;
    }

    /**
     * Complete an active contract. Requires no open obligations and no pending claims.
     */
    @Transactional
    public CommitmentContract complete(String tenantId, String contractId) {
        CommitmentContract contract = lock(tenantId, contractId);

        long openObligations = obligationRepository.countByTenantIdAndContractIdAndStatusIn(
            tenantId, contractId, OPEN_OBLIGATIONS);
        if (openObligations > 0) {
            throw new InvalidStateException("contract", contractId, contract.getStatus().name(), "complete",
                openObligations + " obligation(s) still open");
        }
        long pendingClaims = claimRepository.countByTenantIdAndContractIdAndStatusIn(
            tenantId, contractId, ClaimStatus.pendingStatuses());
        if (pendingClaims > 0) {
            throw new InvalidStateException("contract", contractId, contract.getStatus().name(), "complete",
                pendingClaims + " claim(s) still pending");
        }

        contract.complete();
        log.info("Completed contract {}: released={}, forfeited={}, refunded={} of committed={}", contractId,
            contract.getReleasedAmount(), contract.getForfeitedAmount(), contract.getRefundedAmount(),
            contract.getCommittedAmount());
        return contractRepository.save(contract);
    }

    /**
     * Cancel a contract, settling any held funds per its cancellation policy, then retiring
     * open obligations and unreleased milestones.
     */
    @Transactional
    public CommitmentContract cancel(String tenantId, String contractId, String actor) {
        CommitmentContract contract = lock(tenantId, contractId);
        if (contract.isTerminal() || contract.getStatus() == ContractStatus.DISPUTED) {
            throw new InvalidStateException("contract", contractId, contract.getStatus().name(), "cancel");
        }

        Optional<SecuredBalanceAccount> account = accountRepository.findByTenantIdAndContractId(tenantId, contractId);
        if (account.isPresent() && account.get().getHeld() > 0) {
            settleHeldOnCancellation(contract, account.get(), actor);
        }

        contract.cancel();
        contractRepository.save(contract);

        for (Obligation obligation : obligationRepository.findByTenantIdAndContractIdAndStatusIn(
                tenantId, contractId, OPEN_OBLIGATIONS)) {
            obligation.cancel();
            obligationRepository.save(obligation);
        }
        for (Milestone milestone : milestoneRepository.findByTenantIdAndContractIdAndStatusInOrderBySortOrderAsc(
                tenantId, contractId, UNRELEASED_MILESTONES)) {
            milestone.cancel();
            milestoneRepository.save(milestone);
        }

        log.info("Cancelled contract {} by {} under policy {}", contractId, actor, contract.getCancellationPolicy());
        return contract;
    }

    @Transactional
    public CommitmentContract markDefaulted(String tenantId, String contractId) {
        CommitmentContract contract = lock(tenantId, contractId);
        contract.markDefaulted();
        log.info("Contract {} marked defaulted", contractId);
        return contractRepository.save(contract);
    }

    /**
     * Expire a contract past its {@code expiresAt}: open obligations expire, unreleased milestones
     * are cancelled and the contract defaults. Repeating the call is a no-op.
     */
    @Transactional
    public CommitmentContract expire(String tenantId, String contractId) {
        CommitmentContract contract = lock(tenantId, contractId);
        if (contract.getStatus() == ContractStatus.DEFAULTED) {
            log.debug("Contract {} already defaulted", contractId);
            return contract;
        }

        int expired = 0;
        for (Obligation obligation : obligationRepository.findByTenantIdAndContractIdAndStatusIn(
                tenantId, contractId, OPEN_OBLIGATIONS)) {
            if (obligation.expire()) {
                obligationRepository.save(obligation);
                expired++;
            }
        }
        contract.markDefaulted();
        contractRepository.save(contract);

        for (Milestone milestone : milestoneRepository.findByTenantIdAndContractIdAndStatusInOrderBySortOrderAsc(
                tenantId, contractId, UNRELEASED_MILESTONES)) {
            milestone.cancel();
            milestoneRepository.save(milestone);
        }

        log.info("Expired contract {}: {} obligation(s) expired", contractId, expired);
        return contract;
    }

    @Transactional
    public CommitmentContract updatePolicies(String tenantId, String contractId,
                                             CancellationPolicy cancellationPolicy,
                                             ClaimFreezePolicy claimFreezePolicy) {
        CommitmentContract contract = lock(tenantId, contractId);
        if (contract.isTerminal()) {
            throw new InvalidStateException("contract", contractId, contract.getStatus().name(), "update policies");
        }
        if (cancellationPolicy != null) {
            contract.setCancellationPolicy(cancellationPolicy);
        }
        if (claimFreezePolicy != null) {
            contract.setClaimFreezePolicy(claimFreezePolicy);
        }
        contractRepository.save(contract);

        milestoneEvaluator.evaluateContract(tenantId, contractId);
        return contract;
    }

    private void settleHeldOnCancellation(CommitmentContract contract, SecuredBalanceAccount account, String actor) {
        EntryType entryType = switch (contract.getCancellationPolicy()) {
            case FORFEIT_HELD -> EntryType.FORFEIT;
            case RELEASE_HELD -> EntryType.RELEASE;
            case REFUND_HELD -> EntryType.REFUND;
        };
        AllocationType allocationType = switch (entryType) {
            case RELEASE -> AllocationType.MILESTONE_RELEASE;
            case REFUND -> AllocationType.REFUND;
            default -> AllocationType.FORFEIT;
        };
        SubjectRef target = entryType == EntryType.RELEASE && contract.getCounterpartySubject() != null
            ? contract.getCounterpartySubject()
            : contract.getAnchorSubject();

        ledgerService.post(PostingRequest.builder()
            .tenantId(contract.getTenantId())
            .accountId(account.getId())
            .entryType(entryType)
            .amount(account.getHeld())
            .contractId(contract.getId())
            .idempotencyKey(IdempotencyKey.of(contract.getId(), contract.getId(), "cancellation"))
            .reasonCode("contract_cancellation")
            .notes("Held funds settled on cancellation by " + actor)
            .allocations(List.of(AllocationLine.builder()
                .allocationType(allocationType)
                .amount(account.getHeld())
                .externalLineId("cancellation:" + contract.getId())
                .targetSubject(target)
                .build()))
            .build());
    }

    private CommitmentContract lock(String tenantId, String contractId) {
        return contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
    }
}
