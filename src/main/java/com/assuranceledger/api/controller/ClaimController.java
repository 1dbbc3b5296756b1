package com.assuranceledger.api.controller;

import com.assuranceledger.api.dto.ClaimActionRequest;
import com.assuranceledger.api.dto.ClaimEvidenceRequest;
import com.assuranceledger.api.dto.OpenClaimRequest;
import com.assuranceledger.api.dto.ResolveClaimRequest;
import com.assuranceledger.api.dto.UpdateDisputedAmountRequest;
import com.assuranceledger.claims.Claim;
import com.assuranceledger.claims.ClaimEvent;
import com.assuranceledger.claims.ClaimService;
import com.assuranceledger.claims.OpenClaimCommand;
import com.assuranceledger.claims.ResolveClaimCommand;
import com.assuranceledger.common.Money;
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
 * REST API for claims and disputes.
 */
@RestController
@RequestMapping("/api/v1/claims")
@RequiredArgsConstructor
@Tag(name = "Claims", description = "Claim and dispute API")
public class ClaimController {

    private final ClaimService claimService;

    @PostMapping
    @Operation(summary = "Open a claim, putting the contract into dispute")
    public ResponseEntity<Claim> openClaim(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @Valid @RequestBody OpenClaimRequest request) {

        Claim claim = claimService.open(OpenClaimCommand.builder()
            .tenantId(tenantId)
            .contractId(request.getContractId())
            .milestoneId(request.getMilestoneId())
            .claimType(request.getClaimType())
            .customTypeCode(request.getCustomTypeCode())
            .title(request.getTitle())
            .raisedBy(request.getRaisedBy())
            .against(request.getAgainst())
            .disputedAmount(minorUnitsOrNull(request.getDisputedAmount(), "disputedAmount"))
            .respondByAt(request.getRespondByAt())
            .actor(actor)
            .note(request.getNote())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(claim);
    }

    @GetMapping("/{claimId}")
    @Operation(summary = "Get claim details")
    public ResponseEntity<Claim> getClaim(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String claimId) {
        return ResponseEntity.ok(claimService.get(tenantId, claimId));
    }

    @GetMapping("/contract/{contractId}")
    @Operation(summary = "List the claims raised on a contract")
    public ResponseEntity<List<Claim>> getClaimsByContract(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(claimService.listForContract(tenantId, contractId));
    }

    @GetMapping("/{claimId}/events")
    @Operation(summary = "Get the event history of a claim")
    public ResponseEntity<List<ClaimEvent>> getEvents(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String claimId) {
        return ResponseEntity.ok(claimService.getEvents(tenantId, claimId));
    }

    @PostMapping("/{claimId}/review")
    @Operation(summary = "Start reviewing an open claim")
    public ResponseEntity<Claim> startReview(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @RequestBody(required = false) ClaimActionRequest request) {
        return ResponseEntity.ok(claimService.startReview(tenantId, claimId, actor, noteOf(request)));
    }

    @PostMapping("/{claimId}/escalate")
    @Operation(summary = "Escalate a claim")
    public ResponseEntity<Claim> escalate(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @RequestBody(required = false) ClaimActionRequest request) {
        return ResponseEntity.ok(claimService.escalate(tenantId, claimId, actor, noteOf(request)));
    }

    @PostMapping("/{claimId}/resolve")
    @Operation(summary = "Resolve a claim, posting its settlement when it moves money")
    public ResponseEntity<Claim> resolve(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @Valid @RequestBody ResolveClaimRequest request) {

        Claim claim = claimService.resolve(ResolveClaimCommand.builder()
            .tenantId(tenantId)
            .claimId(claimId)
            .resolutionType(request.getResolutionType())
            .settledAmount(minorUnitsOrNull(request.getSettledAmount(), "settledAmount"))
            .actor(actor)
            .note(request.getNote())
            .build());

        return ResponseEntity.ok(claim);
    }

    @PostMapping("/{claimId}/close")
    @Operation(summary = "Close a resolved claim")
    public ResponseEntity<Claim> close(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @RequestBody(required = false) ClaimActionRequest request) {
        return ResponseEntity.ok(claimService.close(tenantId, claimId, actor, noteOf(request)));
    }

    @PostMapping("/{claimId}/reject")
    @Operation(summary = "Reject an unresolved claim")
    public ResponseEntity<Claim> reject(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @RequestBody(required = false) ClaimActionRequest request) {
        return ResponseEntity.ok(claimService.reject(tenantId, claimId, actor, noteOf(request)));
    }

    @PostMapping("/{claimId}/cancel")
    @Operation(summary = "Withdraw an unresolved claim")
    public ResponseEntity<Claim> cancel(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @RequestBody(required = false) ClaimActionRequest request) {
        return ResponseEntity.ok(claimService.cancel(tenantId, claimId, actor, noteOf(request)));
    }

    @PostMapping("/{claimId}/notes")
    @Operation(summary = "Add a note to a claim")
    public ResponseEntity<ClaimEvent> addNote(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @RequestBody ClaimActionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(claimService.addNote(tenantId, claimId, actor, request.getNote()));
    }

    @PostMapping("/{claimId}/evidence")
    @Operation(summary = "Attach an evidence reference to a claim")
    public ResponseEntity<ClaimEvent> addEvidence(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @Valid @RequestBody ClaimEvidenceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(claimService.addEvidence(tenantId, claimId, actor, request.getEvidenceRef(), request.getNote()));
    }

    @PatchMapping("/{claimId}/disputed-amount")
    @Operation(summary = "Change the amount under dispute")
    public ResponseEntity<Claim> updateDisputedAmount(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String claimId,
            @Valid @RequestBody UpdateDisputedAmountRequest request) {
        Long amount = minorUnitsOrNull(request.getDisputedAmount(), "disputedAmount");
        return ResponseEntity.ok(claimService.updateDisputedAmount(tenantId, claimId, amount, actor));
    }

    private static Long minorUnitsOrNull(BigDecimal value, String field) {
        return value != null ? Money.requireWholeMinorUnits(value, field) : null;
    }

    private static String noteOf(ClaimActionRequest request) {
        return request != null ? request.getNote() : null;
    }
}
