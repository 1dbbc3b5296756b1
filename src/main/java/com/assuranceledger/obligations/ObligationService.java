package com.assuranceledger.obligations;

import com.assuranceledger.common.Money;
import com.assuranceledger.common.TypeCodes;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.NotFoundException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.milestones.MilestoneEvaluator;
import com.assuranceledger.subjects.SubjectRef;
import com.assuranceledger.subjects.SubjectRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.Consumer;

/**
 * Service for obligation lifecycle.
 *
 * Every transition runs under the contract row lock and re-evaluates the milestones linked to
 * the obligation in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ObligationService {

    private final ObligationRepository obligationRepository;
    private final CommitmentContractRepository contractRepository;
    private final MilestoneEvaluator milestoneEvaluator;
    private final SubjectRegistry subjectRegistry;

    @Transactional
    public Obligation create(CreateObligationCommand command) {
        String customTypeCode = TypeCodes.requireCustomCode("obligationType", command.getObligationType(),
            command.getCustomTypeCode());
        if (command.getRequiredAmount() != null) {
            Money.requirePositive(command.getRequiredAmount(), "requiredAmount");
        }
        SubjectRef obligor = subjectRegistry.requireIfPresent(command.getTenantId(), "obligor", command.getObligor());
        SubjectRef beneficiary = subjectRegistry.requireIfPresent(command.getTenantId(), "beneficiary",
            command.getBeneficiary());

        CommitmentContract contract = lockContract(command.getTenantId(), command.getContractId());
        if (contract.isTerminal()) {
            throw new InvalidStateException("contract", contract.getId(), contract.getStatus().name(),
                "add obligation");
        }

        Obligation obligation = new Obligation(command.getTenantId(), contract.getId(), command.getObligationType(),
            customTypeCode, command.getTitle(), obligor, beneficiary,
            command.getRequiredAmount(), command.getDueAt(), command.getSortOrder());
        obligation = obligationRepository.save(obligation);

        log.info("Created {} obligation {} on contract {}", obligation.getObligationType(), obligation.getId(),
            contract.getId());
        return obligation;
    }

    @Transactional(readOnly = true)
    public Obligation get(String tenantId, String obligationId) {
        return obligationRepository.findByTenantIdAndId(tenantId, obligationId)
            .orElseThrow(() -> new NotFoundException("Obligation", obligationId));
    }

    @Transactional(readOnly = true)
    public List<Obligation> listForContract(String tenantId, String contractId) {
        return obligationRepository.findByTenantIdAndContractIdOrderBySortOrderAsc(tenantId, contractId);
    }

    @Transactional
    public Obligation start(String tenantId, String obligationId) {
        return transition(tenantId, obligationId, "start", Obligation::start);
    }

    /**
     * Add a partial amount toward the required amount; reaching it satisfies the obligation.
     */
    @Transactional
    public Obligation recordProgress(String tenantId, String obligationId, long increment) {
        return transition(tenantId, obligationId, "record progress", o -> o.recordProgress(increment));
    }

    @Transactional
    public Obligation satisfy(String tenantId, String obligationId) {
        return transition(tenantId, obligationId, "satisfy", Obligation::satisfy);
    }

    @Transactional
    public Obligation waive(String tenantId, String obligationId) {
        return transition(tenantId, obligationId, "waive", Obligation::waive);
    }

    @Transactional
    public Obligation cancel(String tenantId, String obligationId) {
        return transition(tenantId, obligationId, "cancel", Obligation::cancel);
    }

    @Transactional
    public Obligation reopen(String tenantId, String obligationId) {
        return transition(tenantId, obligationId, "reopen", Obligation::reopen);
    }

    /**
     * Mark an obligation breached. Repeating the call is a no-op. A breach never fails the
     * contract by itself.
     */
    @Transactional
    public Obligation markBreached(String tenantId, String obligationId) {
        return transition(tenantId, obligationId, "breach", ObligationStatus.BREACHED, Obligation::breach);
    }

    /**
     * Mark an obligation expired. Repeating the call is a no-op.
     */
    @Transactional
    public Obligation markExpired(String tenantId, String obligationId) {
        return transition(tenantId, obligationId, "expire", ObligationStatus.EXPIRED, Obligation::expire);
    }

    private Obligation transition(String tenantId, String obligationId, String operation,
                                  Consumer<Obligation> change) {
        return transition(tenantId, obligationId, operation, null, change);
    }

    private Obligation transition(String tenantId, String obligationId, String operation,
                                  ObligationStatus noOpStatus, Consumer<Obligation> change) {
        String contractId = obligationRepository.findContractIdByTenantIdAndId(tenantId, obligationId)
            .orElseThrow(() -> new NotFoundException("Obligation", obligationId));
        CommitmentContract contract = lockContract(tenantId, contractId);
        Obligation obligation = get(tenantId, obligationId);
        if (noOpStatus != null && obligation.getStatus() == noOpStatus) {
            log.debug("Obligation {} already {}", obligationId, noOpStatus);
            return obligation;
        }
        if (contract.isTerminal()) {
            throw new InvalidStateException("contract", contractId, contract.getStatus().name(),
                operation + " obligation");
        }

        ObligationStatus from = obligation.getStatus();
        change.accept(obligation);
        obligation = obligationRepository.save(obligation);

        log.info("Obligation {} {}: {} -> {}", obligationId, operation, from, obligation.getStatus());

        milestoneEvaluator.onObligationChanged(contract, obligation);
        return obligation;
    }

    private CommitmentContract lockContract(String tenantId, String contractId) {
        return contractRepository.findByTenantIdAndIdForUpdate(tenantId, contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
    }
}
