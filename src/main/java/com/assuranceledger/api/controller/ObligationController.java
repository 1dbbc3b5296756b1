package com.assuranceledger.api.controller;

import com.assuranceledger.api.dto.CreateObligationRequest;
import com.assuranceledger.api.dto.RecordProgressRequest;
import com.assuranceledger.common.Money;
import com.assuranceledger.obligations.CreateObligationCommand;
import com.assuranceledger.obligations.Obligation;
import com.assuranceledger.obligations.ObligationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.assuranceledger.api.controller.ContractController.TENANT_HEADER;

/**
 * REST API for obligations.
 */
@RestController
@RequestMapping("/api/v1/obligations")
@RequiredArgsConstructor
@Tag(name = "Obligations", description = "Obligation lifecycle API")
public class ObligationController {

    private final ObligationService obligationService;

    @PostMapping
    @Operation(summary = "Add an obligation to a contract")
    public ResponseEntity<Obligation> createObligation(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody CreateObligationRequest request) {

        Obligation obligation = obligationService.create(CreateObligationCommand.builder()
            .tenantId(tenantId)
            .contractId(request.getContractId())
            .obligationType(request.getObligationType())
            .customTypeCode(request.getCustomTypeCode())
            .title(request.getTitle())
            .obligor(request.getObligor())
            .beneficiary(request.getBeneficiary())
            .requiredAmount(request.getRequiredAmount() != null
                ? Money.requireWholeMinorUnits(request.getRequiredAmount(), "requiredAmount")
                : null)
            .dueAt(request.getDueAt())
            .sortOrder(request.getSortOrder())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(obligation);
    }

    @GetMapping("/{obligationId}")
    @Operation(summary = "Get obligation details")
    public ResponseEntity<Obligation> getObligation(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.get(tenantId, obligationId));
    }

    @GetMapping("/contract/{contractId}")
    @Operation(summary = "List the obligations of a contract")
    public ResponseEntity<List<Obligation>> getObligationsByContract(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(obligationService.listForContract(tenantId, contractId));
    }

    @PostMapping("/{obligationId}/start")
    @Operation(summary = "Start work on an obligation")
    public ResponseEntity<Obligation> start(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.start(tenantId, obligationId));
    }

    @PostMapping("/{obligationId}/progress")
    @Operation(summary = "Record partial progress toward the required amount")
    public ResponseEntity<Obligation> recordProgress(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId,
            @Valid @RequestBody RecordProgressRequest request) {
        long increment = Money.requireWholeMinorUnits(request.getIncrement(), "increment");
        return ResponseEntity.ok(obligationService.recordProgress(tenantId, obligationId, increment));
    }

    @PostMapping("/{obligationId}/satisfy")
    @Operation(summary = "Mark an obligation satisfied")
    public ResponseEntity<Obligation> satisfy(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.satisfy(tenantId, obligationId));
    }

    @PostMapping("/{obligationId}/waive")
    @Operation(summary = "Waive an obligation")
    public ResponseEntity<Obligation> waive(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.waive(tenantId, obligationId));
    }

    @PostMapping("/{obligationId}/breach")
    @Operation(summary = "Mark an obligation breached")
    public ResponseEntity<Obligation> breach(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.markBreached(tenantId, obligationId));
    }

    @PostMapping("/{obligationId}/expire")
    @Operation(summary = "Mark an obligation expired")
    public ResponseEntity<Obligation> expire(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.markExpired(tenantId, obligationId));
    }

    @PostMapping("/{obligationId}/reopen")
    @Operation(summary = "Reopen a satisfied or waived obligation")
    public ResponseEntity<Obligation> reopen(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.reopen(tenantId, obligationId));
    }

    @PostMapping("/{obligationId}/cancel")
    @Operation(summary = "Cancel an obligation")
    public ResponseEntity<Obligation> cancel(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String obligationId) {
        return ResponseEntity.ok(obligationService.cancel(tenantId, obligationId));
    }
}
