package com.assuranceledger.contracts;

import com.assuranceledger.claims.ClaimService;
import com.assuranceledger.claims.ClaimType;
import com.assuranceledger.claims.OpenClaimCommand;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.InvariantViolationException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.ledger.AccountService;
import com.assuranceledger.ledger.AccountType;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.ledger.LedgerEntry;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.OpenAccountCommand;
import com.assuranceledger.ledger.PostingRequest;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.milestones.CreateMilestoneCommand;
import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.MilestoneService;
import com.assuranceledger.milestones.MilestoneStatus;
import com.assuranceledger.obligations.CreateObligationCommand;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationService;
import com.assuranceledger.obligations.ObligationStatus;
import com.assuranceledger.obligations.ObligationType;
import com.assuranceledger.settlement.FundingRequest;
import com.assuranceledger.settlement.FundingService;
import com.assuranceledger.subjects.SubjectRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for contract lifecycle, cancellation and expiry.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ContractServiceTest {

    private static final String TENANT = "tenant-contracts";
    private static final SubjectRef TENANT_USER = SubjectRef.of("user", "renter-1");
    private static final SubjectRef LANDLORD = SubjectRef.of("org", "landlord-1");

    @Autowired
    private ContractService contractService;

    @Autowired
    private ObligationService obligationService;

    @Autowired
    private MilestoneService milestoneService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private FundingService fundingService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ClaimService claimService;

    private CommitmentContract contract;
    private SecuredBalanceAccount account;

    @BeforeEach
    void setUp() {
        contract = createContract(null);
        account = openAccount(contract);
    }

    @Test
    void testNewContractIsDraftWithDefaultPolicies() {
        assertEquals(ContractStatus.DRAFT, contract.getStatus());
        assertEquals(CancellationPolicy.FORFEIT_HELD, contract.getCancellationPolicy());
        assertEquals(ClaimFreezePolicy.FREEZE_ALL, contract.getClaimFreezePolicy());
        assertEquals(6000, contract.getRemainingBudget());
    }

    @Test
    void testCustomTypeNeedsCode() {
        assertThrows(ValidationException.class, () -> contractService.create(CreateContractCommand.builder()
            .tenantId(TENANT)
            .contractType(ContractType.CUSTOM)
            .anchorSubject(TENANT_USER)
            .currency("USD")
            .committedAmount(100)
            .build()));

        CommitmentContract custom = contractService.create(CreateContractCommand.builder()
            .tenantId(TENANT)
            .contractType(ContractType.CUSTOM)
            .customTypeCode("custom_security_deposit")
            .anchorSubject(TENANT_USER)
            .currency("USD")
            .committedAmount(100)
            .build());
        assertEquals("custom_security_deposit", custom.getCustomTypeCode());
    }

    @Test
    void testLifecycleTransitions() {
        contractService.activate(TENANT, contract.getId());
        assertEquals(ContractStatus.PAUSED, contractService.pause(TENANT, contract.getId()).getStatus());
        assertEquals(ContractStatus.ACTIVE, contractService.resume(TENANT, contract.getId()).getStatus());
        assertNotNull(contractService.get(TENANT, contract.getId()).getStartedAt());

        assertThrows(InvalidStateException.class, () -> contractService.activate(TENANT, contract.getId()));
        assertEquals(ContractStatus.COMPLETED, contractService.complete(TENANT, contract.getId()).getStatus());
    }

    @Test
    void testCompleteRequiresObligationsSettled() {
        contractService.activate(TENANT, contract.getId());
        Obligation obligation = createObligation(contract, null);

        assertThrows(InvalidStateException.class, () -> contractService.complete(TENANT, contract.getId()));

        obligationService.satisfy(TENANT, obligation.getId());
        assertEquals(ContractStatus.COMPLETED, contractService.complete(TENANT, contract.getId()).getStatus());
    }

    @Test
    void testCancelForfeitsHeldFunds() {
        contractService.activate(TENANT, contract.getId());
        Obligation obligation = createObligation(contract, null);
        Milestone milestone = createMilestone(contract, 2000);
        fund(contract, account, 6000);

        contractService.cancel(TENANT, contract.getId(), "user:ops-1");

        CommitmentContract cancelled = contractService.get(TENANT, contract.getId());
        assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
        assertEquals(6000, cancelled.getForfeitedAmount());
        assertEquals(0, accountService.get(TENANT, account.getId()).getHeld());
        assertEquals(ObligationStatus.CANCELLED, obligationService.get(TENANT, obligation.getId()).getStatus());
        assertEquals(MilestoneStatus.CANCELLED, milestoneService.get(TENANT, milestone.getId()).getStatus());

        LedgerEntry forfeit = ledgerService.findByIdempotencyKey(TENANT,
            contract.getId() + ":" + contract.getId() + ":cancellation").orElseThrow();
        assertEquals(EntryType.FORFEIT, forfeit.getEntryType());
        assertEquals(6000, forfeit.getAmount());
    }

    @Test
    void testFundingBeyondCommittedAmountIsRejected() {
        contractService.activate(TENANT, contract.getId());
        fund(contract, account, 6000);

        assertThrows(InvariantViolationException.class, () -> fund(contract, account, 1500, "fund-extra"));

        assertEquals(6000, accountService.get(TENANT, account.getId()).getHeld());
        assertEquals(ContractStatus.ACTIVE, contractService.get(TENANT, contract.getId()).getStatus());
    }

    @Test
    void testFullyFundedContractCancelsAfterPartialRelease() {
        contractService.activate(TENANT, contract.getId());
        fund(contract, account, 6000);
        ledgerService.post(PostingRequest.builder()
            .tenantId(TENANT)
            .accountId(account.getId())
            .entryType(EntryType.RELEASE)
            .amount(2000)
            .idempotencyKey("release-" + contract.getId())
            .reasonCode("milestone_release")
            .build());

        // The remaining budget is exactly what is still held
        assertThrows(InvariantViolationException.class, () -> fund(contract, account, 1, "fund-top-up"));

        contractService.cancel(TENANT, contract.getId(), "user:ops-1");

        CommitmentContract cancelled = contractService.get(TENANT, contract.getId());
        assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
        assertEquals(2000, cancelled.getReleasedAmount());
        assertEquals(4000, cancelled.getForfeitedAmount());
        assertEquals(0, cancelled.getRemainingBudget());
        assertEquals(0, accountService.get(TENANT, account.getId()).getHeld());
        assertTrue(ledgerService.reconcile(TENANT, account.getId()).isConsistent());
    }

    @Test
    void testCancelRefundsHeldFundsUnderRefundPolicy() {
        CommitmentContract refundable = createContract(CancellationPolicy.REFUND_HELD);
        SecuredBalanceAccount refundableAccount = openAccount(refundable);
        contractService.activate(TENANT, refundable.getId());
        fund(refundable, refundableAccount, 4000);

        contractService.cancel(TENANT, refundable.getId(), "user:ops-1");

        SecuredBalanceAccount updated = accountService.get(TENANT, refundableAccount.getId());
        assertEquals(0, updated.getHeld());
        assertEquals(0, updated.getBalance());
        assertEquals(4000, updated.getRefunded());
        assertEquals(4000, contractService.get(TENANT, refundable.getId()).getRefundedAmount());
    }

    @Test
    void testDisputedContractCannotBeCancelled() {
        contractService.activate(TENANT, contract.getId());
        claimService.open(OpenClaimCommand.builder()
            .tenantId(TENANT)
            .contractId(contract.getId())
            .claimType(ClaimType.NON_DELIVERY)
            .raisedBy(TENANT_USER)
            .actor("user:renter-1")
            .build());

        assertThrows(InvalidStateException.class,
            () -> contractService.cancel(TENANT, contract.getId(), "user:ops-1"));
    }

    @Test
    void testExpireIsIdempotent() {
        contractService.activate(TENANT, contract.getId());
        Obligation obligation = createObligation(contract, null);
        fund(contract, account, 3000);

        CommitmentContract expired = contractService.expire(TENANT, contract.getId());
        CommitmentContract again = contractService.expire(TENANT, contract.getId());

        assertEquals(ContractStatus.DEFAULTED, expired.getStatus());
        assertEquals(ContractStatus.DEFAULTED, again.getStatus());
        assertEquals(ObligationStatus.EXPIRED, obligationService.get(TENANT, obligation.getId()).getStatus());
        // Held funds stay put until an operator settles them
        assertEquals(3000, accountService.get(TENANT, account.getId()).getHeld());
    }

    @Test
    void testListByStatus() {
        contractService.activate(TENANT, contract.getId());

        List<CommitmentContract> active = contractService.listByStatus(TENANT, ContractStatus.ACTIVE);

        assertTrue(active.stream().anyMatch(c -> c.getId().equals(contract.getId())));
        assertTrue(contractService.listByStatus("other-tenant", ContractStatus.ACTIVE).isEmpty());
    }

    @Test
    void testExpiryBeforeStartIsRejected() {
        Instant now = Instant.now();
        assertThrows(ValidationException.class, () -> contractService.create(CreateContractCommand.builder()
            .tenantId(TENANT)
            .contractType(ContractType.SERVICE)
            .anchorSubject(TENANT_USER)
            .currency("USD")
            .committedAmount(100)
            .startedAt(now)
            .expiresAt(now.minus(1, ChronoUnit.DAYS))
            .build()));
    }

    private CommitmentContract createContract(CancellationPolicy policy) {
        return contractService.create(CreateContractCommand.builder()
            .tenantId(TENANT)
            .contractType(ContractType.PAYMENT_ASSURANCE)
            .title("Lease deposit")
            .anchorSubject(TENANT_USER)
            .counterpartySubject(LANDLORD)
            .currency("USD")
            .committedAmount(6000)
            .cancellationPolicy(policy)
            .build());
    }

    private SecuredBalanceAccount openAccount(CommitmentContract target) {
        return accountService.open(OpenAccountCommand.builder()
            .tenantId(TENANT)
            .contractId(target.getId())
            .accountType(AccountType.DEPOSIT)
            .ownerSubject(TENANT_USER)
            .counterpartySubject(LANDLORD)
            .build());
    }

    private Obligation createObligation(CommitmentContract target, Instant dueAt) {
        return obligationService.create(CreateObligationCommand.builder()
            .tenantId(TENANT)
            .contractId(target.getId())
            .obligationType(ObligationType.PAYMENT)
            .obligor(TENANT_USER)
            .dueAt(dueAt)
            .build());
    }

    private Milestone createMilestone(CommitmentContract target, long amount) {
        return milestoneService.create(CreateMilestoneCommand.builder()
            .tenantId(TENANT)
            .contractId(target.getId())
            .code("move-out")
            .evaluationMode(EvaluationMode.ALL)
            .releaseAmount(amount)
            .build());
    }

    private void fund(CommitmentContract target, SecuredBalanceAccount targetAccount, long amount) {
        fund(target, targetAccount, amount, "fund-" + target.getId());
    }

    private void fund(CommitmentContract target, SecuredBalanceAccount targetAccount, long amount, String key) {
        fundingService.fund(FundingRequest.builder()
            .tenantId(TENANT)
            .accountId(targetAccount.getId())
            .amount(amount)
            .idempotencyKey(key)
            .externalTransactionId("psp-" + key)
            .build());
    }
}
