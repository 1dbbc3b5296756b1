package com.assuranceledger.api.controller;

import com.assuranceledger.api.dto.AdjustAccountRequest;
import com.assuranceledger.api.dto.FundAccountRequest;
import com.assuranceledger.api.dto.HoldFundsRequest;
import com.assuranceledger.api.dto.OpenAccountRequest;
import com.assuranceledger.api.dto.ReverseFundingRequest;
import com.assuranceledger.common.Money;
import com.assuranceledger.ledger.AccountReconciliation;
import com.assuranceledger.ledger.AccountService;
import com.assuranceledger.ledger.LedgerEntry;
import com.assuranceledger.ledger.LedgerService;
import com.assuranceledger.ledger.OpenAccountCommand;
import com.assuranceledger.ledger.PostingResult;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.ledger.SecuredBalanceAllocation;
import com.assuranceledger.settlement.AdjustmentRequest;
import com.assuranceledger.settlement.AdjustmentService;
import com.assuranceledger.settlement.FundingRequest;
import com.assuranceledger.settlement.FundingReversalRequest;
import com.assuranceledger.settlement.FundingService;
import com.assuranceledger.settlement.HoldRequest;
import com.assuranceledger.subjects.SubjectRef;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

import static com.assuranceledger.api.controller.ContractController.ACTOR_HEADER;
import static com.assuranceledger.api.controller.ContractController.TENANT_HEADER;

/**
 * REST API for secured balance accounts and their ledger.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Secured balance account and ledger API")
public class AccountController {

    private final AccountService accountService;
    private final FundingService fundingService;
    private final AdjustmentService adjustmentService;
    private final LedgerService ledgerService;

    @PostMapping
    @Operation(summary = "Open a secured balance account")
    public ResponseEntity<SecuredBalanceAccount> openAccount(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody OpenAccountRequest request) {

        SecuredBalanceAccount account = accountService.open(OpenAccountCommand.builder()
            .tenantId(tenantId)
            .contractId(request.getContractId())
            .accountType(request.getAccountType())
            .customTypeCode(request.getCustomTypeCode())
            .currency(request.getCurrency())
            .ownerSubject(request.getOwnerSubject())
            .counterpartySubject(request.getCounterpartySubject())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account details")
    public ResponseEntity<SecuredBalanceAccount> getAccount(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String accountId) {
        return ResponseEntity.ok(accountService.get(tenantId, accountId));
    }

    @GetMapping("/contract/{contractId}")
    @Operation(summary = "Get the account backing a contract")
    public ResponseEntity<SecuredBalanceAccount> getAccountByContract(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(accountService.getForContract(tenantId, contractId));
    }

    @GetMapping("/owner/{ownerKind}/{ownerId}")
    @Operation(summary = "Get all accounts for an owner")
    public ResponseEntity<List<SecuredBalanceAccount>> getAccountsByOwner(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String ownerKind,
            @PathVariable String ownerId) {
        return ResponseEntity.ok(accountService.listByOwner(tenantId, SubjectRef.of(ownerKind, ownerId)));
    }

    @PostMapping("/{accountId}/fund")
    @Operation(summary = "Record funds received into an account")
    public ResponseEntity<PostingResult> fund(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String accountId,
            @Valid @RequestBody FundAccountRequest request) {

        PostingResult result = fundingService.fund(FundingRequest.builder()
            .tenantId(tenantId)
            .accountId(accountId)
            .amount(Money.requireWholeMinorUnits(request.getAmount(), "amount"))
            .currency(request.getCurrency())
            .idempotencyKey(request.getIdempotencyKey())
            .externalTransactionId(request.getExternalTransactionId())
            .sourceSubject(request.getSourceSubject())
            .notes(request.getNotes())
            .build());

        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED).body(result);
    }

    @PostMapping("/{accountId}/reversals")
    @Operation(summary = "Reverse a funding entry, e.g. after a chargeback")
    public ResponseEntity<PostingResult> reverseFunding(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String accountId,
            @Valid @RequestBody ReverseFundingRequest request) {

        PostingResult result = fundingService.reverseFunding(FundingReversalRequest.builder()
            .tenantId(tenantId)
            .accountId(accountId)
            .fundingEntryId(request.getFundingEntryId())
            .idempotencyKey(request.getIdempotencyKey())
            .reasonCode(request.getReasonCode())
            .notes(request.getNotes())
            .build());

        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED).body(result);
    }

    @PostMapping("/{accountId}/holds")
    @Operation(summary = "Move available balance into held")
    public ResponseEntity<PostingResult> hold(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String accountId,
            @Valid @RequestBody HoldFundsRequest request) {

        PostingResult result = adjustmentService.hold(HoldRequest.builder()
            .tenantId(tenantId)
            .accountId(accountId)
            .amount(Money.requireWholeMinorUnits(request.getAmount(), "amount"))
            .idempotencyKey(request.getIdempotencyKey())
            .reasonCode(request.getReasonCode())
            .notes(request.getNotes())
            .build());

        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED).body(result);
    }

    @PostMapping("/{accountId}/adjustments")
    @Operation(summary = "Post an operator correction with signed deltas")
    public ResponseEntity<PostingResult> adjust(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String accountId,
            @Valid @RequestBody AdjustAccountRequest request) {

        PostingResult result = adjustmentService.adjust(AdjustmentRequest.builder()
            .tenantId(tenantId)
            .accountId(accountId)
            .balanceDelta(signedOrZero(request.getBalanceDelta(), "balanceDelta"))
            .heldDelta(signedOrZero(request.getHeldDelta(), "heldDelta"))
            .correctsEntryId(request.getCorrectsEntryId())
            .idempotencyKey(request.getIdempotencyKey())
            .reasonCode(request.getReasonCode())
            .externalReference(request.getExternalReference())
            .actor(actor)
            .notes(request.getNotes())
            .build());

        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{accountId}/ledger")
    @Operation(summary = "Get ledger entries for an account")
    public ResponseEntity<List<LedgerEntry>> getAccountLedger(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.getAccountLedger(tenantId, accountId));
    }

    @GetMapping("/entries/{entryId}/allocations")
    @Operation(summary = "Get the allocation lines of a ledger entry")
    public ResponseEntity<List<SecuredBalanceAllocation>> getAllocations(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String entryId) {
        return ResponseEntity.ok(ledgerService.getAllocations(tenantId, entryId));
    }

    @GetMapping("/{accountId}/reconciliation")
    @Operation(summary = "Fold the ledger and compare it with the account snapshot")
    public ResponseEntity<AccountReconciliation> reconcile(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.reconcile(tenantId, accountId));
    }

    @PostMapping("/{accountId}/close")
    @Operation(summary = "Close an account with no held funds")
    public ResponseEntity<SecuredBalanceAccount> closeAccount(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String accountId) {
        return ResponseEntity.ok(accountService.close(tenantId, accountId));
    }

    private static long signedOrZero(BigDecimal value, String field) {
        return value == null ? 0 : Money.requireWholeMinorUnits(value, field);
    }
}
