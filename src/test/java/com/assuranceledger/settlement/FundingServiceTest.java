package com.assuranceledger.settlement;

import com.assuranceledger.common.exception.InsufficientSecuredFundsException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.ContractService;
import com.assuranceledger.contracts.ContractType;
import com.assuranceledger.contracts.CreateContractCommand;
import com.assuranceledger.ledger.AccountService;
import com.assuranceledger.ledger.AccountType;
import com.assuranceledger.ledger.EntryStatus;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.OpenAccountCommand;
import com.assuranceledger.ledger.PostingResult;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.subjects.SubjectRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for funding and funding reversals.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class FundingServiceTest {

    private static final String TENANT = "tenant-funding";

    @Autowired
    private FundingService fundingService;

    @Autowired
    private ContractService contractService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    private CommitmentContract contract;
    private SecuredBalanceAccount account;

    @BeforeEach
    void setUp() {
        contract = contractService.create(CreateContractCommand.builder()
            .tenantId(TENANT)
            .contractType(ContractType.RETAINAGE)
            .anchorSubject(SubjectRef.of("org", "owner-1"))
            .counterpartySubject(SubjectRef.of("org", "builder-1"))
            .currency("EUR")
            .committedAmount(5000)
            .build());
        account = accountService.open(OpenAccountCommand.builder()
            .tenantId(TENANT)
            .contractId(contract.getId())
            .accountType(AccountType.RETAINAGE)
            .ownerSubject(SubjectRef.of("org", "owner-1"))
            .build());
        contractService.activate(TENANT, contract.getId());
    }

    @Test
    void testAccountInheritsContractCurrency() {
        assertEquals("EUR", account.getCurrency());
    }

    @Test
    void testFundingIncreasesBalanceAndHeld() {
        PostingResult result = fund(5000, "fund-1");

        assertFalse(result.isReplayed());
        assertEquals(EntryType.FUND, result.getEntry().getEntryType());
        assertEquals(contract.getId(), result.getEntry().getContractId());

        SecuredBalanceAccount updated = accountService.get(TENANT, account.getId());
        assertEquals(5000, updated.getBalance());
        assertEquals(5000, updated.getHeld());
    }

    @Test
    void testDuplicateFundingIsReplayed() {
        PostingResult first = fund(5000, "fund-1");
        PostingResult second = fund(5000, "fund-1");

        assertTrue(second.isReplayed());
        assertEquals(first.getEntry().getId(), second.getEntry().getId());
        assertEquals(5000, accountService.get(TENANT, account.getId()).getHeld());
        assertEquals(1, ledgerService.getAccountLedger(TENANT, account.getId()).size());
    }

    @Test
    void testFundingInOtherCurrencyIsRejected() {
        assertThrows(ValidationException.class, () -> fundingService.fund(FundingRequest.builder()
            .tenantId(TENANT)
            .accountId(account.getId())
            .amount(100)
            .currency("USD")
            .idempotencyKey("fund-usd")
            .build()));
    }

    @Test
    void testReversalNegatesFunding() {
        PostingResult funding = fund(5000, "fund-1");

        PostingResult reversal = fundingService.reverseFunding(FundingReversalRequest.builder()
            .tenantId(TENANT)
            .accountId(account.getId())
            .fundingEntryId(funding.getEntry().getId())
            .idempotencyKey("chargeback-1")
            .build());

        assertEquals(EntryType.REVERSAL, reversal.getEntry().getEntryType());
        assertEquals(funding.getEntry().getId(), reversal.getEntry().getReversesEntryId());
        assertEquals("chargeback", reversal.getEntry().getReasonCode());
        assertEquals(EntryStatus.REVERSED, ledgerService.getEntry(TENANT, funding.getEntry().getId()).getStatus());

        SecuredBalanceAccount updated = accountService.get(TENANT, account.getId());
        assertEquals(0, updated.getBalance());
        assertEquals(0, updated.getHeld());
        assertTrue(ledgerService.reconcile(TENANT, account.getId()).isConsistent());
    }

    @Test
    void testReversalOfDisbursedFundsIsRejected() {
        PostingResult funding = fund(5000, "fund-1");
        contractService.cancel(TENANT, contract.getId(), "user:ops-1");

        // Cancellation forfeited everything held, so nothing is left to claw back
        assertThrows(InsufficientSecuredFundsException.class, () -> fundingService.reverseFunding(
            FundingReversalRequest.builder()
                .tenantId(TENANT)
                .accountId(account.getId())
                .fundingEntryId(funding.getEntry().getId())
                .idempotencyKey("chargeback-1")
                .build()));
    }

    @Test
    void testFundingCancelledContractIsRejected() {
        contractService.cancel(TENANT, contract.getId(), "user:ops-1");

        assertThrows(InvalidStateException.class, () -> fund(100, "late-fund"));
    }

    private PostingResult fund(long amount, String key) {
        return fundingService.fund(FundingRequest.builder()
            .tenantId(TENANT)
            .accountId(account.getId())
            .amount(amount)
            .currency("EUR")
            .idempotencyKey(key)
            .externalTransactionId("psp-" + key)
            .sourceSubject(SubjectRef.of("org", "owner-1"))
            .build());
    }
}
