package com.assuranceledger.api.controller;

import com.assuranceledger.api.dto.CreateContractRequest;
import com.assuranceledger.api.dto.UpdatePoliciesRequest;
import com.assuranceledger.common.Money;
import com.assuranceledger.contracts.CommitmentContract;
import com.assuranceledger.contracts.ContractService;
import com.assuranceledger.contracts.ContractStatus;
import com.assuranceledger.contracts.CreateContractCommand;
import com.assuranceledger.ledger.LedgerEntry;
import com.assuranceledger.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for commitment contracts.
 */
@RestController
@RequestMapping("/api/v1/contracts")
@RequiredArgsConstructor
@Tag(name = "Contracts", description = "Commitment contract lifecycle API")
public class ContractController {

    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String ACTOR_HEADER = "X-Actor-Id";

    private final ContractService contractService;
    private final LedgerService ledgerService;

    @PostMapping
    @Operation(summary = "Create a draft contract")
    public ResponseEntity<CommitmentContract> createContract(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody CreateContractRequest request) {

        CommitmentContract contract = contractService.create(CreateContractCommand.builder()
            .tenantId(tenantId)
            .contractType(request.getContractType())
            .customTypeCode(request.getCustomTypeCode())
            .title(request.getTitle())
            .anchorSubject(request.getAnchorSubject())
            .counterpartySubject(request.getCounterpartySubject())
            .currency(request.getCurrency())
            .committedAmount(Money.requireWholeMinorUnits(request.getCommittedAmount(), "committedAmount"))
            .startedAt(request.getStartedAt())
            .expiresAt(request.getExpiresAt())
            .cancellationPolicy(request.getCancellationPolicy())
            .claimFreezePolicy(request.getClaimFreezePolicy())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(contract);
    }

    @GetMapping("/{contractId}")
    @Operation(summary = "Get contract details")
    public ResponseEntity<CommitmentContract> getContract(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.get(tenantId, contractId));
    }

    @GetMapping
    @Operation(summary = "List contracts in a status")
    public ResponseEntity<List<CommitmentContract>> listContracts(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam ContractStatus status) {
        return ResponseEntity.ok(contractService.listByStatus(tenantId, status));
    }

    @PostMapping("/{contractId}/activate")
    @Operation(summary = "Activate a draft contract")
    public ResponseEntity<CommitmentContract> activate(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.activate(tenantId, contractId));
    }

    @PostMapping("/{contractId}/pause")
    @Operation(summary = "Pause an active contract")
    public ResponseEntity<CommitmentContract> pause(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.pause(tenantId, contractId));
    }

    @PostMapping("/{contractId}/resume")
    @Operation(summary = "Resume a paused contract")
    public ResponseEntity<CommitmentContract> resume(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.resume(tenantId, contractId));
    }

    @PostMapping("/{contractId}/complete")
    @Operation(summary = "Complete a contract with no open obligations or pending claims")
    public ResponseEntity<CommitmentContract> complete(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.complete(tenantId, contractId));
    }

    @PostMapping("/{contractId}/cancel")
    @Operation(summary = "Cancel a contract, settling held funds per its cancellation policy")
    public ResponseEntity<CommitmentContract> cancel(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.cancel(tenantId, contractId, actor));
    }

    @PostMapping("/{contractId}/default")
    @Operation(summary = "Mark a contract defaulted")
    public ResponseEntity<CommitmentContract> markDefaulted(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.markDefaulted(tenantId, contractId));
    }

    @PostMapping("/{contractId}/expire")
    @Operation(summary = "Expire a contract past its end date")
    public ResponseEntity<CommitmentContract> expire(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(contractService.expire(tenantId, contractId));
    }

    @PatchMapping("/{contractId}/policies")
    @Operation(summary = "Change the cancellation or claim freeze policy")
    public ResponseEntity<CommitmentContract> updatePolicies(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId,
            @RequestBody UpdatePoliciesRequest request) {
        return ResponseEntity.ok(contractService.updatePolicies(tenantId, contractId,
            request.getCancellationPolicy(), request.getClaimFreezePolicy()));
    }

    @GetMapping("/{contractId}/ledger")
    @Operation(summary = "Get ledger entries posted for a contract")
    public ResponseEntity<List<LedgerEntry>> getContractLedger(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(ledgerService.getContractLedger(tenantId, contractId));
    }
}
