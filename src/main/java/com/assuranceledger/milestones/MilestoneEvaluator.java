package com.assuranceledger.milestones;

import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.milestones.evaluation.EvaluationResult;
import com.assuranceledger.milestones.evaluation.EvaluationStrategy;
import com.assuranceledger.milestones.evaluation.LinkedObligation;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationRepository;
import com.assuranceledger.settlement.ReleaseService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Re-scores milestones against the current state of their linked obligations.
 *
 * Evaluation always recomputes from obligation rows, never from the milestone's history, so
 * running it twice without an obligation change is a no-op. Callers hold the contract row lock;
 * milestone evaluation is serialized per contract.
 */
@Service
@Slf4j
public class MilestoneEvaluator {

    private static final List<MilestoneStatus> EVALUABLE = List.of(MilestoneStatus.PENDING, MilestoneStatus.READY);

    private final Map<EvaluationMode, EvaluationStrategy> strategies;
    private final MilestoneRepository milestoneRepository;
    private final MilestoneObligationLinkRepository linkRepository;
    private final ObligationRepository obligationRepository;
    private final CommitmentContractRepository contractRepository;
    private final ReleaseService releaseService;

    public MilestoneEvaluator(List<EvaluationStrategy> strategies,
                              MilestoneRepository milestoneRepository,
                              MilestoneObligationLinkRepository linkRepository,
                              ObligationRepository obligationRepository,
                              CommitmentContractRepository contractRepository,
                              ReleaseService releaseService) {
        this.strategies = new EnumMap<>(EvaluationMode.class);
        for (EvaluationStrategy strategy : strategies) {
            this.strategies.put(strategy.getMode(), strategy);
        }
        this.milestoneRepository = milestoneRepository;
        this.linkRepository = linkRepository;
        this.obligationRepository = obligationRepository;
        this.contractRepository = contractRepository;
        this.releaseService = releaseService;
    }

    /**
     * Pure evaluation: no reads, no writes.
     */
    public EvaluationResult evaluate(Milestone milestone, List<LinkedObligation> links) {
        EvaluationStrategy strategy = strategies.get(milestone.getEvaluationMode());
        if (strategy == null) {
            throw new IllegalStateException("No evaluation strategy for mode " + milestone.getEvaluationMode());
        }
        return strategy.evaluate(milestone, links);
    }

    /**
     * Score a milestone without changing it.
     */
    @Transactional(readOnly = true)
    public EvaluationResult preview(String tenantId, String milestoneId) {
        Milestone milestone = milestoneRepository.findByTenantIdAndId(tenantId, milestoneId)
            .orElseThrow(() -> new NotFoundException("Milestone", milestoneId));
        return evaluate(milestone, loadLinks(tenantId, milestoneId));
    }

    /**
     * Re-evaluate every pending or ready milestone linked to an obligation that just changed.
     */
    @Transactional
    public void onObligationChanged(CommitmentContract contract, Obligation obligation) {
        List<String> milestoneIds = linkRepository
            .findByTenantIdAndObligationId(obligation.getTenantId(), obligation.getId())
            .stream()
            .map(MilestoneObligationLink::getMilestoneId)
            .distinct()
            .collect(Collectors.toList());
        if (milestoneIds.isEmpty()) {
            return;
        }

        log.debug("Obligation {} is now {}; re-evaluating {} milestone(s)",
            obligation.getId(), obligation.getStatus(), milestoneIds.size());

        for (Milestone milestone : milestoneRepository.findByTenantIdAndIdInAndStatusIn(
                obligation.getTenantId(), milestoneIds, EVALUABLE)) {
            evaluateMilestone(contract, milestone);
        }
    }

    /**
     * Re-evaluate every pending or ready milestone of a contract, retrying automatic releases
     * that were blocked before (no funds, claim freeze, contract paused).
     */
    @Transactional
    public void evaluateContract(String tenantId, String contractId) {
        CommitmentContract contract = contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
        if (contract.isTerminal()) {
            return;
        }
        for (Milestone milestone : milestoneRepository
                .findByTenantIdAndContractIdAndStatusInOrderBySortOrderAsc(tenantId, contractId, EVALUABLE)) {
            evaluateMilestone(contract, milestone);
        }
    }

    /**
     * Move one milestone between pending and ready to match its score, then release it if it is
     * ready and automatic.
     */
    @Transactional
    public void evaluateMilestone(CommitmentContract contract, Milestone milestone) {
        if (!milestone.getStatus().isEvaluable()) {
            return;
        }
        EvaluationResult result = evaluate(milestone, loadLinks(milestone.getTenantId(), milestone.getId()));

        if (result.isReady() && !milestone.isReady()) {
            milestone.markReady();
            milestoneRepository.save(milestone);
            log.info("Milestone {} ({}) is ready: {}", milestone.getId(), milestone.getCode(), result.getReason());
        } else if (!result.isReady() && milestone.isReady()) {
            milestone.markPending();
            milestoneRepository.save(milestone);
            log.info("Milestone {} ({}) fell back to pending: {}", milestone.getId(), milestone.getCode(),
                result.getReason());
        }

        if (milestone.isReady() && milestone.isAutomatic()) {
            releaseService.releaseAutomatically(contract, milestone);
        }
    }

    List<LinkedObligation> loadLinks(String tenantId, String milestoneId) {
        List<MilestoneObligationLink> links =
            linkRepository.findByTenantIdAndMilestoneIdOrderBySortOrderAsc(tenantId, milestoneId);
        if (links.isEmpty()) {
            return List.of();
        }
        Map<String, Obligation> obligations = obligationRepository
            .findByTenantIdAndIdIn(tenantId, links.stream().map(MilestoneObligationLink::getObligationId)
                .collect(Collectors.toList()))
            .stream()
            .collect(Collectors.toMap(Obligation::getId, Function.identity()));

        List<LinkedObligation> linked = new ArrayList<>();
        for (MilestoneObligationLink link : links) {
            Obligation obligation = obligations.get(link.getObligationId());
            if (obligation != null) {
                linked.add(new LinkedObligation(link.getObligationId(), link.getWeight(), link.isRequired(),
                    obligation.getStatus()));
            }
        }
        return linked;
    }
}
