package com.assuranceledger.scheduler;

import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.contracts.ContractService;
import com.assuranceledger.contracts.ContractStatus;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationRepository;
import com.assuranceledger.obligations.ObligationService;
import com.assuranceledger.obligations.ObligationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Background sweep that breaches overdue obligations and expires contracts past
 * {@code expiresAt}.
 *
 * Each item runs in its own transaction through the idempotent service operations.
 * Disabled unless {@code assurance-ledger.scheduler.enabled=true}.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "assurance-ledger.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DueDateSweepJob {

    private static final List<ObligationStatus> OPEN_OBLIGATIONS =
        List.of(ObligationStatus.PENDING, ObligationStatus.IN_PROGRESS);
    private static final List<ContractStatus> EXPIRABLE_CONTRACTS =
        List.of(ContractStatus.ACTIVE, ContractStatus.PAUSED);

    private final ObligationRepository obligationRepository;
    private final CommitmentContractRepository contractRepository;
    private final ObligationService obligationService;
    private final ContractService contractService;

    @Scheduled(fixedDelayString = "${assurance-ledger.scheduler.sweep-interval-ms:60000}")
    public void sweep() {
        Instant now = Instant.now();
        int breached = breachOverdueObligations(now);
        int expired = expireContracts(now);
        if (breached > 0 || expired > 0) {
            log.info("Due-date sweep completed: {} obligation(s) breached, {} contract(s) expired", breached, expired);
        } else {
            log.debug("Due-date sweep completed: nothing overdue");
        }
    }

    int breachOverdueObligations(Instant now) {
        int breached = 0;
        for (Obligation obligation : obligationRepository.findByStatusInAndDueAtBefore(OPEN_OBLIGATIONS, now)) {
            try {
                obligationService.markBreached(obligation.getTenantId(), obligation.getId());
                breached++;
            } catch (RuntimeException e) {
                log.error("Failed to breach overdue obligation {} of tenant {}", obligation.getId(),
                    obligation.getTenantId(), e);
            }
        }
        return breached;
    }

    int expireContracts(Instant now) {
        int expired = 0;
        for (CommitmentContract contract : contractRepository.findByStatusInAndExpiresAtBefore(EXPIRABLE_CONTRACTS, now)) {
            try {
                contractService.expire(contract.getTenantId(), contract.getId());
                expired++;
            } catch (RuntimeException e) {
                log.error("Failed to expire contract {} of tenant {}", contract.getId(), contract.getTenantId(), e);
            }
        }
        return expired;
    }
}
