package com.assuranceledger.claims;

import com.assuranceledger.common.IdempotencyKey;
import com.assuranceledger.common.Money;
import com.assuranceledger.common.TypeCodes;
import com.assuranceledger.common.exception.AccountNotFoundException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.contracts.ContractStatus;
import com.assuranceledger.ledger.AllocationLine;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.PostingRequest;
import com.assuranceledger.ledger.PostingResult;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.ledger.SecuredBalanceAccountRepository;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.MilestoneEvaluator;
import com.assuranceledger.milestones.MilestoneRepository;
import com.assuranceledger.subjects.SubjectRef;
import com.assuranceledger.subjects.SubjectRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for the claim lifecycle.
 *
 * Claim flow:
 * 1. Open: the contract enters dispute and its freeze policy applies to releases
 * 2. Review or escalate
 * 3. Resolve, optionally posting a settlement through the ledger
 * 4. Close, reject or cancel: once no claim is pending the contract leaves dispute
 *
 * Every status change appends exactly one {@link ClaimEvent}. Claims never touch balances
 * directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimService {

    private final ClaimRepository claimRepository;
    private final ClaimEventRepository eventRepository;
    private final CommitmentContractRepository contractRepository;
    private final MilestoneRepository milestoneRepository;
    private final SecuredBalanceAccountRepository accountRepository;
    private final LedgerService ledgerService;
    private final MilestoneEvaluator milestoneEvaluator;
    private final SubjectRegistry subjectRegistry;

    @Transactional
    public Claim open(OpenClaimCommand command) {
        String customTypeCode = TypeCodes.requireCustomCode("claimType", command.getClaimType(),
            command.getCustomTypeCode());
        SubjectRef raisedBy = subjectRegistry.require(command.getTenantId(), "raisedBy", command.getRaisedBy());
        SubjectRef against = subjectRegistry.requireIfPresent(command.getTenantId(), "against", command.getAgainst());
        if (command.getDisputedAmount() != null) {
            Money.requireNonNegative(command.getDisputedAmount(), "disputedAmount");
        }

        CommitmentContract contract = lockContract(command.getTenantId(), command.getContractId());
        if (command.getMilestoneId() != null) {
            Milestone milestone = milestoneRepository.findByTenantIdAndId(command.getTenantId(),
                    command.getMilestoneId())
                .orElseThrow(() -> new NotFoundException("Milestone", command.getMilestoneId()));
            if (!milestone.getContractId().equals(contract.getId())) {
                throw new ValidationException("milestoneId",
                    "milestone " + milestone.getId() + " belongs to another contract");
            }
        }

        contract.enterDispute();
        contractRepository.save(contract);

        Claim claim = new Claim(command.getTenantId(), contract.getId(), command.getMilestoneId(),
            command.getClaimType(), customTypeCode, command.getTitle(), raisedBy, against,
            command.getDisputedAmount(), command.getRespondByAt());
        claim = claimRepository.save(claim);
        record(claim, ClaimEventType.OPENED, command.getActor(), null, null, command.getNote());

        log.info("Opened {} claim {} on contract {} by {}; contract is now {} with freeze policy {}",
            claim.getClaimType(), claim.getId(), contract.getId(), raisedBy, contract.getStatus(),
            contract.getClaimFreezePolicy());
        return claim;
    }

    @Transactional(readOnly = true)
    public Claim get(String tenantId, String claimId) {
        return claimRepository.findByTenantIdAndId(tenantId, claimId)
            .orElseThrow(() -> new NotFoundException("Claim", claimId));
    }

    @Transactional(readOnly = true)
    public List<Claim> listForContract(String tenantId, String contractId) {
        return claimRepository.findByTenantIdAndContractIdOrderByOpenedAtAsc(tenantId, contractId);
    }

    @Transactional(readOnly = true)
    public List<ClaimEvent> getEvents(String tenantId, String claimId) {
        return eventRepository.findByTenantIdAndClaimIdOrderByOccurredAtAsc(tenantId, claimId);
    }

    @Transactional
    public Claim startReview(String tenantId, String claimId, String actor, String note) {
        Claim claim = lockAndGet(tenantId, claimId);
        ClaimStatus from = claim.getStatus();
        claim.startReview();
        return saveTransition(claim, ClaimEventType.REVIEW_STARTED, actor, from, null, note);
    }

    @Transactional
    public Claim escalate(String tenantId, String claimId, String actor, String note) {
        Claim claim = lockAndGet(tenantId, claimId);
        ClaimStatus from = claim.getStatus();
        claim.escalate();
        return saveTransition(claim, ClaimEventType.ESCALATED, actor, from, null, note);
    }

    /**
     * Resolve a claim. Release, refund, forfeit and partial settlement resolutions with a
     * positive settled amount post a compensating entry keyed {@code contractId:claimId:settlement}.
     */
    @Transactional
    public Claim resolve(ResolveClaimCommand command) {
        String contractId = claimRepository.findContractIdByTenantIdAndId(command.getTenantId(), command.getClaimId())
            .orElseThrow(() -> new NotFoundException("Claim", command.getClaimId()));
        CommitmentContract contract = lockContract(command.getTenantId(), contractId);
        Claim claim = get(command.getTenantId(), command.getClaimId());

        ClaimStatus from = claim.getStatus();
        claim.resolve(command.getResolutionType(), command.getSettledAmount(), command.getActor());

        String entryId = null;
        ResolutionType resolution = claim.getResolutionType();
        if (resolution.postsSettlement() && claim.getSettledAmount() != null && claim.getSettledAmount() > 0) {
            PostingResult posting = postSettlement(contract, claim);
            entryId = posting.getEntry().getId();
            claim.attachSettlement(entryId);
        }

        log.info("Resolved claim {} as {} with settled amount {}", claim.getId(), resolution,
            claim.getSettledAmount());
        return saveTransition(claim, ClaimEventType.RESOLVED, command.getActor(), from, entryId, command.getNote());
    }

    @Transactional
    public Claim close(String tenantId, String claimId, String actor, String note) {
        Claim claim = lockAndGet(tenantId, claimId);
        ClaimStatus from = claim.getStatus();
        claim.close();
        claim = saveTransition(claim, ClaimEventType.CLOSED, actor, from, null, note);
        exitDisputeIfSettled(tenantId, claim.getContractId());
        return claim;
    }

    @Transactional
    public Claim reject(String tenantId, String claimId, String actor, String note) {
        Claim claim = lockAndGet(tenantId, claimId);
        ClaimStatus from = claim.getStatus();
        claim.reject();
        claim = saveTransition(claim, ClaimEventType.REJECTED, actor, from, null, note);
        exitDisputeIfSettled(tenantId, claim.getContractId());
        return claim;
    }

    @Transactional
    public Claim cancel(String tenantId, String claimId, String actor, String note) {
        Claim claim = lockAndGet(tenantId, claimId);
        ClaimStatus from = claim.getStatus();
        claim.cancel();
        claim = saveTransition(claim, ClaimEventType.CANCELLED, actor, from, null, note);
        exitDisputeIfSettled(tenantId, claim.getContractId());
        return claim;
    }

    @Transactional
    public ClaimEvent addNote(String tenantId, String claimId, String actor, String note) {
        if (note == null || note.isBlank()) {
            throw new ValidationException("note", "is required");
        }
        Claim claim = get(tenantId, claimId);
        return record(claim, ClaimEventType.NOTE, actor, claim.getStatus(), null, note);
    }

    @Transactional
    public ClaimEvent addEvidence(String tenantId, String claimId, String actor, String evidenceRef, String note) {
        if (evidenceRef == null || evidenceRef.isBlank()) {
            throw new ValidationException("evidenceRef", "is required");
        }
        Claim claim = get(tenantId, claimId);
        String text = note != null ? "Evidence " + evidenceRef + ": " + note : "Evidence " + evidenceRef;
        return record(claim, ClaimEventType.EVIDENCE_ADDED, actor, claim.getStatus(), null, text);
    }

    @Transactional
    public Claim updateDisputedAmount(String tenantId, String claimId, Long disputedAmount, String actor) {
        Claim claim = lockAndGet(tenantId, claimId);
        Long previous = claim.getDisputedAmount();
        claim.updateDisputedAmount(disputedAmount);
        claim = claimRepository.save(claim);
        record(claim, ClaimEventType.AMOUNT_UPDATED, actor, claim.getStatus(), null,
            "Disputed amount " + previous + " -> " + disputedAmount);
        return claim;
    }

    private PostingResult postSettlement(CommitmentContract contract, Claim claim) {
        SecuredBalanceAccount account = accountRepository
            .findByTenantIdAndContractId(contract.getTenantId(), contract.getId())
            .orElseThrow(() -> AccountNotFoundException.forContract(contract.getId()));
        ResolutionType resolution = claim.getResolutionType();

        SubjectRef target = switch (resolution) {
            case RELEASE_FUNDS -> contract.getCounterpartySubject();
            case REFUND -> contract.getAnchorSubject();
            default -> claim.getAgainst();
        };

        return ledgerService.post(PostingRequest.builder()
            .tenantId(contract.getTenantId())
            .accountId(account.getId())
            .entryType(resolution.getSettlementEntryType())
            .amount(claim.getSettledAmount())
            .contractId(contract.getId())
            .milestoneId(claim.getMilestoneId())
            .idempotencyKey(IdempotencyKey.of(contract.getId(), claim.getId(), "settlement"))
            .reasonCode("claim_" + resolution.name().toLowerCase())
            .notes("Settlement of claim " + claim.getId())
            .allocations(List.of(AllocationLine.builder()
                .allocationType(resolution.getAllocationType())
                .amount(claim.getSettledAmount())
                .milestoneId(claim.getMilestoneId())
                .externalLineId("claim:" + claim.getId())
                .targetSubject(target)
                .build()))
            .build());
    }

    private void exitDisputeIfSettled(String tenantId, String contractId) {
        CommitmentContract contract = lockContract(tenantId, contractId);
        if (contract.getStatus() != ContractStatus.DISPUTED) {
            return;
        }
        long pending = claimRepository.countByTenantIdAndContractIdAndStatusIn(tenantId, contractId,
            ClaimStatus.pendingStatuses());
        if (pending > 0) {
            log.debug("Contract {} stays disputed: {} claim(s) pending", contractId, pending);
            return;
        }
        contract.exitDispute();
        contractRepository.save(contract);
        log.info("Contract {} left dispute and is {} again", contractId, contract.getStatus());

        milestoneEvaluator.evaluateContract(tenantId, contractId);
    }

    private Claim saveTransition(Claim claim, ClaimEventType eventType, String actor, ClaimStatus from,
                                 String ledgerEntryId, String note) {
        claim = claimRepository.save(claim);
        record(claim, eventType, actor, from, ledgerEntryId, note);
        log.info("Claim {} {}: {} -> {}", claim.getId(), eventType, from, claim.getStatus());
        return claim;
    }

    private ClaimEvent record(Claim claim, ClaimEventType eventType, String actor, ClaimStatus from,
                              String ledgerEntryId, String note) {
        return eventRepository.save(new ClaimEvent(claim, eventType, actor, from, ledgerEntryId, note));
    }

    private Claim lockAndGet(String tenantId, String claimId) {
        String contractId = claimRepository.findContractIdByTenantIdAndId(tenantId, claimId)
            .orElseThrow(() -> new NotFoundException("Claim", claimId));
        lockContract(tenantId, contractId);
        return get(tenantId, claimId);
    }

    private CommitmentContract lockContract(String tenantId, String contractId) {
        return contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
    }
}
