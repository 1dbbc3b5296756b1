package com.assuranceledger.settlement;

import com.assuranceledger.claims.Claim;
import com.assuranceledger.claims.ClaimFreezeGuard;
import com.assuranceledger.common.IdempotencyKey;
import com.assuranceledger.common.exception.AccountNotFoundException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.ledger.AllocationLine;
import com.assuranceledger.ledger.AllocationPlanner;
import com.assuranceledger.ledger.AllocationType;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.ledger.LedgerEntry;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.PostingRequest;
import com.assuranceledger.ledger.PostingResult;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.ledger.SecuredBalanceAccountRepository;
import com.assuranceledger.ledger.SecuredBalanceAllocation;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.MilestoneObligationLinkRepository;
import com.assuranceledger.milestones.MilestoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Releases the amount of a ready milestone to the counterparty.
 *
 * Release flow:
 * 1. Lock the contract and check the milestone is ready
 * 2. Check the contract is in force and no claim freezes the milestone
 * 3. Post a release entry with allocations proportional to link weights
 * 4. Mark the milestone released
 *
 * The posting and the milestone transition share one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReleaseService {

    static final String AUTOMATIC_ACTOR = "system:auto-release";

    private final MilestoneRepository milestoneRepository;
    private final MilestoneObligationLinkRepository linkRepository;
    private final CommitmentContractRepository contractRepository;
    private final SecuredBalanceAccountRepository accountRepository;
    private final LedgerService ledgerService;
    private final ClaimFreezeGuard claimFreezeGuard;

    @Transactional
    public ReleaseResult release(String tenantId, String milestoneId, String actor) {
        String contractId = milestoneRepository.findContractIdByTenantIdAndId(tenantId, milestoneId)
            .orElseThrow(() -> new NotFoundException("Milestone", milestoneId));
        CommitmentContract contract = contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
        Milestone milestone = milestoneRepository.findByTenantIdAndId(tenantId, milestoneId)
            .orElseThrow(() -> new NotFoundException("Milestone", milestoneId));

        if (milestone.isReleased()) {
            log.info("Milestone {} was already released by {}", milestoneId, milestone.getReleasedBy());
            Optional<LedgerEntry> entry = ledgerService.findByIdempotencyKey(tenantId, releaseKey(milestone));
            List<SecuredBalanceAllocation> allocations = entry
                .map(e -> ledgerService.getAllocations(tenantId, e.getId()))
                .orElse(List.of());
            return new ReleaseResult(ReleaseResult.Outcome.ALREADY_RELEASED, milestone, entry.orElse(null), allocations);
        }
        if (!milestone.isReady()) {
            throw new InvalidStateException("milestone", milestoneId, milestone.getStatus().name(), "release");
        }
        if (!contract.isInForce()) {
            throw new InvalidStateException("contract", contract.getId(), contract.getStatus().name(),
                "release milestone " + milestone.getCode());
        }
        Optional<Claim> freezing = claimFreezeGuard.findFreezingClaim(contract, milestoneId);
        if (freezing.isPresent()) {
            throw new InvalidStateException("milestone", milestoneId, milestone.getStatus().name(), "release",
                "releases are frozen by claim " + freezing.get().getId());
        }

        return doRelease(contract, milestone, actor);
    }

    /**
     * Release a ready automatic milestone if nothing blocks it. A blocked milestone stays
     * ready and is retried on the next contract evaluation.
     *
     * @return whether the milestone was released
     */
    @Transactional
    public boolean releaseAutomatically(CommitmentContract contract, Milestone milestone) {
        if (!contract.isInForce()) {
            log.debug("Automatic release of milestone {} deferred: contract {} is {}",
                milestone.getId(), contract.getId(), contract.getStatus());
            return false;
        }
        Optional<String> blocker = findBlocker(contract, milestone);
        if (blocker.isPresent()) {
            log.warn("Automatic release of milestone {} ({}) blocked: {}",
                milestone.getId(), milestone.getCode(), blocker.get());
            return false;
        }
        doRelease(contract, milestone, AUTOMATIC_ACTOR);
        return true;
    }

    static String releaseKey(Milestone milestone) {
        return IdempotencyKey.of(milestone.getContractId(), milestone.getId(), "release");
    }

    private Optional<String> findBlocker(CommitmentContract contract, Milestone milestone) {
        Optional<Claim> freezing = claimFreezeGuard.findFreezingClaim(contract, milestone.getId());
        if (freezing.isPresent()) {
            return Optional.of("frozen by claim " + freezing.get().getId());
        }
        long amount = milestone.getReleaseAmount();
        if (amount == 0) {
            return Optional.empty();
        }
        Optional<SecuredBalanceAccount> account =
            accountRepository.findByTenantIdAndContractId(contract.getTenantId(), contract.getId());
        if (account.isEmpty()) {
            return Optional.of("contract has no secured balance account");
        }
        if (!account.get().isOpen()) {
            return Optional.of("account " + account.get().getId() + " is closed");
        }
        if (account.get().getHeld() < amount) {
            return Optional.of(String.format("held %d is below release amount %d", account.get().getHeld(), amount));
        }
        if (contract.getRemainingBudget() < amount) {
            return Optional.of(String.format("remaining committed budget %d is below release amount %d",
                contract.getRemainingBudget(), amount));
        }
        return Optional.empty();
    }

    private ReleaseResult doRelease(CommitmentContract contract, Milestone milestone, String actor) {
        LedgerEntry entry = null;
        List<SecuredBalanceAllocation> allocations = List.of();

        if (milestone.getReleaseAmount() > 0) {
            SecuredBalanceAccount account = accountRepository
                .findByTenantIdAndContractId(contract.getTenantId(), contract.getId())
                .orElseThrow(() -> AccountNotFoundException.forContract(contract.getId()));

            PostingResult posting = ledgerService.post(PostingRequest.builder()
                .tenantId(contract.getTenantId())
                .accountId(account.getId())
                .entryType(EntryType.RELEASE)
                .amount(milestone.getReleaseAmount())
                .contractId(contract.getId())
                .milestoneId(milestone.getId())
                .idempotencyKey(releaseKey(milestone))
                .reasonCode("milestone_release")
                .notes("Milestone " + milestone.getCode() + " released by " + actor)
                .allocations(planAllocations(milestone))
                .build());
            entry = posting.getEntry();
            allocations = posting.getAllocations();
        }

        milestone.markReleased(actor);
        milestoneRepository.save(milestone);

        log.info("Released milestone {} ({}) of contract {}: amount={}, entry={}, by={}",
            milestone.getId(), milestone.getCode(), contract.getId(), milestone.getReleaseAmount(),
            entry != null ? entry.getId() : null, actor);

        return new ReleaseResult(ReleaseResult.Outcome.RELEASED, milestone, entry, allocations);
    }

    private List<AllocationLine> planAllocations(Milestone milestone) {
        List<AllocationPlanner.WeightedTarget> targets = linkRepository
            .findByTenantIdAndMilestoneIdOrderBySortOrderAsc(milestone.getTenantId(), milestone.getId())
            .stream()
            .map(link -> new AllocationPlanner.WeightedTarget(link.getObligationId(), link.getWeight()))
            .collect(Collectors.toList());
        return AllocationPlanner.proportional(milestone.getReleaseAmount(), AllocationType.MILESTONE_RELEASE,
            milestone.getId(), targets);
    }
}
