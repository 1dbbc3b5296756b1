package com.assuranceledger.ledger;

import com.assuranceledger.common.exception.ConcurrencyConflictException;
import com.assuranceledger.common.exception.InsufficientSecuredFundsException;
import com.assuranceledger.common.exception.InvariantViolationException;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.ContractService;
import com.assuranceledger.contracts.ContractType;
import com.assuranceledger.contracts.CreateContractCommand;
import com.assuranceledger.settlement.FundingRequest;
import com.assuranceledger.settlement.FundingService;
import com.assuranceledger.subjects.SubjectRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parallel postings against one contract account. Each posting commits in its own
 * transaction, so this class is deliberately not {@code @Transactional}; every run works
 * in a fresh tenant instead.
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrentPostingTest {

    private static final int THREADS = 10;
    private static final long COMMITTED = 3000;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ContractService contractService;

    @Autowired
    private FundingService fundingService;

    private ExecutorService executor;
    private String tenant;
    private SecuredBalanceAccount account;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
        tenant = "tenant-" + UUID.randomUUID();
        CommitmentContract contract = contractService.create(CreateContractCommand.builder()
            .tenantId(tenant)
            .contractType(ContractType.SERVICE)
            .anchorSubject(SubjectRef.of("user", "client-1"))
            .currency("USD")
            .committedAmount(COMMITTED)
            .build());
        contractService.activate(tenant, contract.getId());
        account = accountService.open(OpenAccountCommand.builder()
            .tenantId(tenant)
            .contractId(contract.getId())
            .accountType(AccountType.DEPOSIT)
            .ownerSubject(SubjectRef.of("user", "client-1"))
            .build());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testParallelFundingNeverExceedsCommittedAmount() throws Exception {
        List<Callable<PostingResult>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String key = "fund-" + i;
            tasks.add(() -> fund(500, key));
        }

        Outcome outcome = runTogether(tasks);

        assertEquals(6, outcome.successes);
        for (Throwable failure : outcome.failures) {
            assertInstanceOf(InvariantViolationException.class, failure);
        }
        SecuredBalanceAccount snapshot = accountService.get(tenant, account.getId());
        assertEquals(outcome.successes * 500L, snapshot.getHeld());
        assertTrue(snapshot.getHeld() <= COMMITTED);
        assertEquals(outcome.successes, ledgerService.getAccountLedger(tenant, account.getId()).size());
        assertTrue(ledgerService.reconcile(tenant, account.getId()).isConsistent());
    }

    @Test
    void testParallelFundingWithOneKeyPostsOnce() throws Exception {
        List<Callable<PostingResult>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(() -> fund(1000, "fund-once"));
        }

        Outcome outcome = runTogether(tasks);

        long fresh = outcome.results.stream().filter(result -> !result.isReplayed()).count();
        assertEquals(1, fresh);
        for (Throwable failure : outcome.failures) {
            assertInstanceOf(ConcurrencyConflictException.class, failure);
        }
        LedgerEntry entry = ledgerService.findByIdempotencyKey(tenant, "fund-once").orElseThrow();
        for (PostingResult result : outcome.results) {
            assertEquals(entry.getId(), result.getEntry().getId());
        }
        assertEquals(1, ledgerService.getAccountLedger(tenant, account.getId()).size());
        assertEquals(1000, accountService.get(tenant, account.getId()).getHeld());
        assertTrue(ledgerService.reconcile(tenant, account.getId()).isConsistent());
    }

    @Test
    void testParallelReleasesStayWithinBudget() throws Exception {
        fund(COMMITTED, "fund-all");
        List<Callable<PostingResult>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String key = "release-" + i;
            tasks.add(() -> ledgerService.post(PostingRequest.builder()
                .tenantId(tenant)
                .accountId(account.getId())
                .entryType(EntryType.RELEASE)
                .amount(400)
                .idempotencyKey(key)
                .reasonCode("milestone_release")
                .build()));
        }

        Outcome outcome = runTogether(tasks);

        assertEquals(7, outcome.successes);
        for (Throwable failure : outcome.failures) {
            assertInstanceOf(InsufficientSecuredFundsException.class, failure);
        }
        CommitmentContract contract = contractService.get(tenant, account.getContractId());
        assertEquals(2800, contract.getReleasedAmount());
        assertEquals(200, accountService.get(tenant, account.getId()).getHeld());
        assertEquals(1 + outcome.successes, ledgerService.getAccountLedger(tenant, account.getId()).size());
        assertTrue(ledgerService.reconcile(tenant, account.getId()).isConsistent());
    }

    private PostingResult fund(long amount, String key) {
        return fundingService.fund(FundingRequest.builder()
            .tenantId(tenant)
            .accountId(account.getId())
            .amount(amount)
            .idempotencyKey(key)
            .externalTransactionId("psp-" + key)
            .build());
    }

    private Outcome runTogether(List<Callable<PostingResult>> tasks) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PostingResult>> futures = new ArrayList<>();
        for (Callable<PostingResult> task : tasks) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();

        Outcome outcome = new Outcome();
        for (Future<PostingResult> future : futures) {
            try {
                outcome.results.add(future.get(30, TimeUnit.SECONDS));
                outcome.successes++;
            } catch (ExecutionException e) {
                outcome.failures.add(e.getCause());
            } catch (TimeoutException e) {
                fail("posting did not finish: " + e.getMessage());
            }
        }
        return outcome;
    }

    private static class Outcome {
        private final List<PostingResult> results = new ArrayList<>();
        private final List<Throwable> failures = new ArrayList<>();
        private int successes;
    }
}
