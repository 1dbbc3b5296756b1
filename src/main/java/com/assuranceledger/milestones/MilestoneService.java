package com.assuranceledger.milestones;

import com.assuranceledger.common.Money;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for milestone definition and the links that feed its evaluation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MilestoneService {

    private final MilestoneRepository milestoneRepository;
    private final MilestoneObligationLinkRepository linkRepository;
    private final ObligationRepository obligationRepository;
    private final CommitmentContractRepository contractRepository;
    private final MilestoneEvaluator milestoneEvaluator;

    @Transactional
    public Milestone create(CreateMilestoneCommand command) {
        if (command.getCode() == null || command.getCode().isBlank()) {
            throw new ValidationException("code", "is required");
        }
        if (command.getEvaluationMode() == null) {
            throw new ValidationException("evaluationMode", "is required");
        }
        if (command.getReleaseMode() == null) {
            throw new ValidationException("releaseMode", "is required");
        }
        Money.requireNonNegative(command.getReleaseAmount(), "releaseAmount");
        if (command.getEvaluationMode() == EvaluationMode.THRESHOLD) {
            if (command.getMinSatisfiedCount() == null || command.getMinSatisfiedCount() < 1) {
                throw new ValidationException("minSatisfiedCount", "threshold milestones need a count >= 1");
            }
        } else if (command.getMinSatisfiedCount() != null || command.getThresholdCounting() != null) {
            throw new ValidationException("minSatisfiedCount", "only threshold milestones take a threshold");
        }

        CommitmentContract contract = lockContract(command.getTenantId(), command.getContractId());
        if (contract.isTerminal()) {
            throw new InvalidStateException("contract", contract.getId(), contract.getStatus().name(),
                "add milestone");
        }
        if (milestoneRepository.existsByTenantIdAndContractIdAndCode(command.getTenantId(), contract.getId(),
                command.getCode())) {
            throw new ValidationException("code",
                "milestone " + command.getCode() + " already exists on contract " + contract.getId());
        }

        Milestone milestone = new Milestone(command.getTenantId(), contract.getId(), command.getCode(),
            command.getTitle(), command.getEvaluationMode(), command.getMinSatisfiedCount(),
            command.getThresholdCounting(), command.getReleaseMode(), command.getReleaseAmount(),
            command.getDueAt(), command.getSortOrder());
        milestone = milestoneRepository.save(milestone);

        log.info("Created {} milestone {} ({}) on contract {} releasing {}", milestone.getEvaluationMode(),
            milestone.getId(), milestone.getCode(), contract.getId(),
            Money.of(milestone.getReleaseAmount(), contract.getCurrency()));
        return milestone;
    }

    /**
     * Link an obligation to a milestone. Both must belong to the same contract. The milestone
     * is re-evaluated right away since the new link can change its readiness.
     */
    @Transactional
    public MilestoneObligationLink link(LinkObligationCommand command) {
        if (command.getWeight() <= 0) {
            throw new ValidationException("weight", "must be > 0, got " + command.getWeight());
        }
        String contractId = milestoneRepository.findContractIdByTenantIdAndId(command.getTenantId(),
                command.getMilestoneId())
            .orElseThrow(() -> new NotFoundException("Milestone", command.getMilestoneId()));
        CommitmentContract contract = lockContract(command.getTenantId(), contractId);
        Milestone milestone = get(command.getTenantId(), command.getMilestoneId());
        Obligation obligation = obligationRepository.findByTenantIdAndId(command.getTenantId(),
                command.getObligationId())
            .orElseThrow(() -> new NotFoundException("Obligation", command.getObligationId()));

        if (!obligation.getContractId().equals(contractId)) {
            throw new ValidationException("obligationId",
                "obligation " + obligation.getId() + " belongs to another contract");
        }
        if (!milestone.getStatus().isEvaluable()) {
            throw new InvalidStateException("milestone", milestone.getId(), milestone.getStatus().name(),
                "link obligation");
        }
        if (linkRepository.existsByTenantIdAndMilestoneIdAndObligationId(command.getTenantId(),
                milestone.getId(), obligation.getId())) {
            throw new ValidationException("obligationId",
                "obligation " + obligation.getId() + " is already linked to milestone " + milestone.getId());
        }

        MilestoneObligationLink link = linkRepository.save(new MilestoneObligationLink(command.getTenantId(),
            contractId, milestone.getId(), obligation.getId(), command.getWeight(), command.isRequired(),
            command.getSortOrder()));

        log.info("Linked obligation {} to milestone {} (weight={}, required={})", obligation.getId(),
            milestone.getId(), link.getWeight(), link.isRequired());

        milestoneEvaluator.evaluateMilestone(contract, milestone);
        return link;
    }

    @Transactional(readOnly = true)
    public Milestone get(String tenantId, String milestoneId) {
        return milestoneRepository.findByTenantIdAndId(tenantId, milestoneId)
            .orElseThrow(() -> new NotFoundException("Milestone", milestoneId));
    }

    @Transactional(readOnly = true)
    public List<Milestone> listForContract(String tenantId, String contractId) {
        return milestoneRepository.findByTenantIdAndContractIdOrderBySortOrderAsc(tenantId, contractId);
    }

    @Transactional(readOnly = true)
    public List<MilestoneObligationLink> getLinks(String tenantId, String milestoneId) {
        return linkRepository.findByTenantIdAndMilestoneIdOrderBySortOrderAsc(tenantId, milestoneId);
    }

    @Transactional
    public Milestone cancel(String tenantId, String milestoneId) {
        Milestone milestone = lockAndGet(tenantId, milestoneId);
        milestone.cancel();
        log.info("Cancelled milestone {} ({})", milestoneId, milestone.getCode());
        return milestoneRepository.save(milestone);
    }

    /**
     * Retire a milestone without releasing its amount, e.g. when an obligation it depends on
     * was waived.
     */
    @Transactional
    public Milestone skip(String tenantId, String milestoneId) {
        Milestone milestone = lockAndGet(tenantId, milestoneId);
        milestone.skip();
        log.info("Skipped milestone {} ({})", milestoneId, milestone.getCode());
        return milestoneRepository.save(milestone);
    }

    private Milestone lockAndGet(String tenantId, String milestoneId) {
        String contractId = milestoneRepository.findContractIdByTenantIdAndId(tenantId, milestoneId)
            .orElseThrow(() -> new NotFoundException("Milestone", milestoneId));
        lockContract(tenantId, contractId);
        return get(tenantId, milestoneId);
    }

    private CommitmentContract lockContract(String tenantId, String contractId) {
        return contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
    }
}
