package com.assuranceledger.scheduler;

import com.assuranceledger.common.exception.ConcurrencyConflictException;
import com.assuranceledger.contracts.CommitmentContractRepository;
import com.assuranceledger.contracts.ContractService;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationRepository;
import com.assuranceledger.obligations.ObligationService;
import com.assuranceledger.obligations.ObligationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the sweep loop itself, with the services mocked out.
 */
@ExtendWith(MockitoExtension.class)
class DueDateSweepJobUnitTest {

    @Mock
    private ObligationRepository obligationRepository;

    @Mock
    private CommitmentContractRepository contractRepository;

    @Mock
    private ObligationService obligationService;

    @Mock
    private ContractService contractService;

    private DueDateSweepJob job;

    @BeforeEach
    void setUp() {
        job = new DueDateSweepJob(obligationRepository, contractRepository, obligationService, contractService);
    }

    @Test
    void testFailingItemDoesNotStopTheSweep() {
        Instant past = Instant.parse("2026-01-01T00:00:00Z");
        Obligation first = new Obligation("tenant-1", "contract-1", ObligationType.SERVICE_DELIVERY, null,
            "Deliver", null, null, null, past, 0);
        Obligation second = new Obligation("tenant-2", "contract-2", ObligationType.SERVICE_DELIVERY, null,
            "Deliver", null, null, null, past, 0);
        when(obligationRepository.findByStatusInAndDueAtBefore(anyCollection(), any(Instant.class)))
            .thenReturn(List.of(first, second));
        when(obligationService.markBreached("tenant-1", first.getId()))
            .thenThrow(new ConcurrencyConflictException("contract-1 is busy", null));

        int breached = job.breachOverdueObligations(Instant.now());

        assertEquals(1, breached);
        verify(obligationService).markBreached("tenant-2", second.getId());
    }

    @Test
    void testEmptySweepTouchesNoService() {
        when(obligationRepository.findByStatusInAndDueAtBefore(anyCollection(), any(Instant.class)))
            .thenReturn(List.of());
        when(contractRepository.findByStatusInAndExpiresAtBefore(anyCollection(), any(Instant.class)))
            .thenReturn(List.of());

        job.sweep();

        verifyNoInteractions(obligationService, contractService);
    }
}
