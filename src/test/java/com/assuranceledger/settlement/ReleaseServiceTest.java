package com.assuranceledger.settlement;

import com.assuranceledger.common.exception.InsufficientSecuredFundsException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.ContractService;
import com.assuranceledger.contracts.ContractType;
import com.assuranceledger.contracts.CreateContractCommand;
import com.assuranceledger.ledger.AccountService;
import com.assuranceledger.ledger.AccountType;
import com.assuranceledger.ledger.AllocationType;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.OpenAccountCommand;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.ledger.SecuredBalanceAllocation;
import com.assuranceledger.milestones.CreateMilestoneCommand;
import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.LinkObligationCommand;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.MilestoneService;
import com.assuranceledger.milestones.MilestoneStatus;
import com.assuranceledger.milestones.ReleaseMode;
import com.assuranceledger.obligations.CreateObligationCommand;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationService;
import com.assuranceledger.obligations.ObligationType;
import com.assuranceledger.subjects.SubjectRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Transactional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for milestone releases with releases lowering held funds only.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = "assurance-ledger.ledger.disbursement-mode=HELD_ONLY")
@Transactional
class ReleaseServiceTest {

    private static final String TENANT = "tenant-release";

    @Autowired
    private ReleaseService releaseService;

    @Autowired
    private FundingService fundingService;

    @Autowired
    private ContractService contractService;

    @Autowired
    private ObligationService obligationService;

    @Autowired
    private MilestoneService milestoneService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    private CommitmentContract contract;
    private SecuredBalanceAccount account;
    private Obligation delivery;
    private Obligation inspection;

    @BeforeEach
    void setUp() {
        contract = contractService.create(CreateContractCommand.builder()
            .tenantId(TENANT)
            .contractType(ContractType.ESCROW)
            .title("Kitchen renovation")
            .anchorSubject(SubjectRef.of("user", "buyer-1"))
            .counterpartySubject(SubjectRef.of("org", "vendor-1"))
            .currency("USD")
            .committedAmount(10000)
            .build());

        delivery = createObligation("Deliver cabinets");
        inspection = createObligation("Pass inspection");

        account = accountService.open(OpenAccountCommand.builder()
            .tenantId(TENANT)
            .contractId(contract.getId())
            .accountType(AccountType.ESCROW)
            .ownerSubject(SubjectRef.of("user", "buyer-1"))
            .build());

        contractService.activate(TENANT, contract.getId());
    }

    @Test
    void testReleaseLowersHeldOnly() {
        Milestone milestone = createMilestone("A", ReleaseMode.MANUAL, 4000);
        fund(10000, "fund-1");

        // First obligation alone does not make the milestone ready
        obligationService.satisfy(TENANT, delivery.getId());
        assertEquals(MilestoneStatus.PENDING, milestoneService.get(TENANT, milestone.getId()).getStatus());

        obligationService.satisfy(TENANT, inspection.getId());
        assertEquals(MilestoneStatus.READY, milestoneService.get(TENANT, milestone.getId()).getStatus());

        ReleaseResult result = releaseService.release(TENANT, milestone.getId(), "user:ops-1");

        assertEquals(ReleaseResult.Outcome.RELEASED, result.getOutcome());
        assertEquals(EntryType.RELEASE, result.getEntry().getEntryType());
        assertEquals(4000, result.getEntry().getAmount());
        assertEquals(MilestoneStatus.RELEASED, result.getMilestone().getStatus());

        SecuredBalanceAccount updated = accountService.get(TENANT, account.getId());
        assertEquals(10000, updated.getBalance());
        assertEquals(6000, updated.getHeld());
        assertEquals(4000, updated.getReleased());
        assertEquals(4000, contractService.get(TENANT, contract.getId()).getReleasedAmount());
    }

    @Test
    void testReleaseSplitsAcrossLinkedObligations() {
        Milestone milestone = createMilestone("A", ReleaseMode.MANUAL, 4001);
        fund(10000, "fund-1");
        obligationService.satisfy(TENANT, delivery.getId());
        obligationService.satisfy(TENANT, inspection.getId());

        ReleaseResult result = releaseService.release(TENANT, milestone.getId(), "user:ops-1");

        assertEquals(2, result.getAllocations().size());
        long total = 0;
        for (SecuredBalanceAllocation allocation : result.getAllocations()) {
            assertEquals(AllocationType.MILESTONE_RELEASE, allocation.getAllocationType());
            assertEquals(milestone.getId(), allocation.getMilestoneId());
            total += allocation.getAllocatedAmount();
        }
        assertEquals(4001, total);
        assertEquals(2001, result.getAllocations().stream()
            .filter(a -> a.getObligationId().equals(delivery.getId()))
            .findFirst().orElseThrow().getAllocatedAmount());
    }

    @Test
    void testReleaseIsIdempotent() {
        Milestone milestone = createMilestone("A", ReleaseMode.MANUAL, 4000);
        fund(10000, "fund-1");
        obligationService.satisfy(TENANT, delivery.getId());
        obligationService.satisfy(TENANT, inspection.getId());

        ReleaseResult first = releaseService.release(TENANT, milestone.getId(), "user:ops-1");
        ReleaseResult second = releaseService.release(TENANT, milestone.getId(), "user:ops-2");

        assertFalse(first.isAlreadyReleased());
        assertTrue(second.isAlreadyReleased());
        assertEquals(first.getEntry().getId(), second.getEntry().getId());
        assertEquals(2, ledgerService.getAccountLedger(TENANT, account.getId()).size());
        assertEquals(6000, accountService.get(TENANT, account.getId()).getHeld());
    }

    @Test
    void testReleaseOfPendingMilestoneIsRejected() {
        Milestone milestone = createMilestone("A", ReleaseMode.MANUAL, 4000);
        fund(10000, "fund-1");
        obligationService.satisfy(TENANT, delivery.getId());

        assertThrows(InvalidStateException.class,
            () -> releaseService.release(TENANT, milestone.getId(), "user:ops-1"));
    }

    @Test
    void testReleaseAboveHeldLeavesSnapshotsUnchanged() {
        Milestone milestone = createMilestone("A", ReleaseMode.MANUAL, 4000);
        fund(3000, "fund-1");
        obligationService.satisfy(TENANT, delivery.getId());
        obligationService.satisfy(TENANT, inspection.getId());

        assertThrows(InsufficientSecuredFundsException.class,
            () -> releaseService.release(TENANT, milestone.getId(), "user:ops-1"));

        SecuredBalanceAccount unchanged = accountService.get(TENANT, account.getId());
        assertEquals(3000, unchanged.getBalance());
        assertEquals(3000, unchanged.getHeld());
        assertEquals(0, unchanged.getReleased());
        assertEquals(0, contractService.get(TENANT, contract.getId()).getReleasedAmount());
        assertEquals(MilestoneStatus.READY, milestoneService.get(TENANT, milestone.getId()).getStatus());
        assertEquals(1, ledgerService.getAccountLedger(TENANT, account.getId()).size());
    }

    @Test
    void testAutomaticReleaseWaitsForFunding() {
        Milestone milestone = createMilestone("A", ReleaseMode.AUTOMATIC, 4000);
        obligationService.satisfy(TENANT, delivery.getId());
        obligationService.satisfy(TENANT, inspection.getId());

        // Ready but blocked: nothing is held yet
        assertEquals(MilestoneStatus.READY, milestoneService.get(TENANT, milestone.getId()).getStatus());

        fund(10000, "fund-1");

        Milestone released = milestoneService.get(TENANT, milestone.getId());
        assertEquals(MilestoneStatus.RELEASED, released.getStatus());
        assertEquals(ReleaseService.AUTOMATIC_ACTOR, released.getReleasedBy());
        assertEquals(6000, accountService.get(TENANT, account.getId()).getHeld());
    }

    @Test
    void testZeroAmountMilestonePostsNothing() {
        Milestone milestone = createMilestone("A", ReleaseMode.MANUAL, 0);
        obligationService.satisfy(TENANT, delivery.getId());
        obligationService.satisfy(TENANT, inspection.getId());

        ReleaseResult result = releaseService.release(TENANT, milestone.getId(), "user:ops-1");

        assertEquals(MilestoneStatus.RELEASED, result.getMilestone().getStatus());
        assertNull(result.getEntry());
        assertTrue(ledgerService.getAccountLedger(TENANT, account.getId()).isEmpty());
    }

    private Obligation createObligation(String title) {
        return obligationService.create(CreateObligationCommand.builder()
            .tenantId(TENANT)
            .contractId(contract.getId())
            .obligationType(ObligationType.SERVICE_DELIVERY)
            .title(title)
            .obligor(SubjectRef.of("org", "vendor-1"))
            .build());
    }

    private Milestone createMilestone(String code, ReleaseMode releaseMode, long amount) {
        Milestone milestone = milestoneService.create(CreateMilestoneCommand.builder()
            .tenantId(TENANT)
            .contractId(contract.getId())
            .code(code)
            .evaluationMode(EvaluationMode.ALL)
            .releaseMode(releaseMode)
            .releaseAmount(amount)
            .build());
        milestoneService.link(LinkObligationCommand.builder()
            .tenantId(TENANT)
            .milestoneId(milestone.getId())
            .obligationId(delivery.getId())
            .sortOrder(0)
            .build());
        milestoneService.link(LinkObligationCommand.builder()
            .tenantId(TENANT)
            .milestoneId(milestone.getId())
            .obligationId(inspection.getId())
            .sortOrder(1)
            .build());
        return milestone;
    }

    private void fund(long amount, String key) {
        fundingService.fund(FundingRequest.builder()
            .tenantId(TENANT)
            .accountId(account.getId())
            .amount(amount)
            .currency("USD")
            .idempotencyKey(key)
            .externalTransactionId("psp-" + key)
            .build());
    }
}
