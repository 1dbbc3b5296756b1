package com.assuranceledger.api.controller;

import com.assuranceledger.api.dto.CreateMilestoneRequest;
import com.assuranceledger.api.dto.LinkObligationRequest;
import com.assuranceledger.common.Money;
import com.assuranceledger.milestones.CreateMilestoneCommand;
import com.assuranceledger.milestones.LinkObligationCommand;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.milestones.MilestoneEvaluator;
import com.assuranceledger.milestones.MilestoneObligationLink;
import com.assuranceledger.milestones.MilestoneService;
import com.assuranceledger.milestones.evaluation.EvaluationResult;
import com.assuranceledger.settlement.ReleaseResult;
import com.assuranceledger.settlement.ReleaseService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.assuranceledger.api.controller.ContractController.ACTOR_HEADER;
import static com.assuranceledger.api.controller.ContractController.TENANT_HEADER;

/**
 * REST API for milestones, their obligation links and releases.
 */
@RestController
@RequestMapping("/api/v1/milestones")
@RequiredArgsConstructor
@Tag(name = "Milestones", description = "Milestone definition, evaluation and release API")
public class MilestoneController {

    private final MilestoneService milestoneService;
    private final MilestoneEvaluator milestoneEvaluator;
    private final ReleaseService releaseService;

    @PostMapping
    @Operation(summary = "Define a milestone on a contract")
    public ResponseEntity<Milestone> createMilestone(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody CreateMilestoneRequest request) {

        Milestone milestone = milestoneService.create(CreateMilestoneCommand.builder()
            .tenantId(tenantId)
            .contractId(request.getContractId())
            .code(request.getCode())
            .title(request.getTitle())
            .evaluationMode(request.getEvaluationMode())
            .minSatisfiedCount(request.getMinSatisfiedCount())
            .thresholdCounting(request.getThresholdCounting())
            .releaseMode(request.getReleaseMode())
            .releaseAmount(Money.requireWholeMinorUnits(request.getReleaseAmount(), "releaseAmount"))
            .dueAt(request.getDueAt())
            .sortOrder(request.getSortOrder())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(milestone);
    }

    @GetMapping("/{milestoneId}")
    @Operation(summary = "Get milestone details")
    public ResponseEntity<Milestone> getMilestone(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String milestoneId) {
        return ResponseEntity.ok(milestoneService.get(tenantId, milestoneId));
    }

    @GetMapping("/contract/{contractId}")
    @Operation(summary = "List the milestones of a contract")
    public ResponseEntity<List<Milestone>> getMilestonesByContract(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String contractId) {
        return ResponseEntity.ok(milestoneService.listForContract(tenantId, contractId));
    }

    @PostMapping("/{milestoneId}/links")
    @Operation(summary = "Link an obligation to a milestone")
    public ResponseEntity<MilestoneObligationLink> linkObligation(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String milestoneId,
            @Valid @RequestBody LinkObligationRequest request) {

        MilestoneObligationLink link = milestoneService.link(LinkObligationCommand.builder()
            .tenantId(tenantId)
            .milestoneId(milestoneId)
            .obligationId(request.getObligationId())
            .weight(request.getWeight())
            .required(request.isRequired())
            .sortOrder(request.getSortOrder())
            .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(link);
    }

    @GetMapping("/{milestoneId}/links")
    @Operation(summary = "List the obligations linked to a milestone")
    public ResponseEntity<List<MilestoneObligationLink>> getLinks(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String milestoneId) {
        return ResponseEntity.ok(milestoneService.getLinks(tenantId, milestoneId));
    }

    @GetMapping("/{milestoneId}/evaluation")
    @Operation(summary = "Preview a milestone's readiness without changing it")
    public ResponseEntity<EvaluationResult> previewEvaluation(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String milestoneId) {
        return ResponseEntity.ok(milestoneEvaluator.preview(tenantId, milestoneId));
    }

    @PostMapping("/{milestoneId}/release")
    @Operation(summary = "Release a ready milestone's amount from held funds")
    public ResponseEntity<ReleaseResult> release(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String milestoneId) {
        return ResponseEntity.ok(releaseService.release(tenantId, milestoneId, actor));
    }

    @PostMapping("/{milestoneId}/skip")
    @Operation(summary = "Skip a milestone without releasing it")
    public ResponseEntity<Milestone> skip(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String milestoneId) {
        return ResponseEntity.ok(milestoneService.skip(tenantId, milestoneId));
    }

    @PostMapping("/{milestoneId}/cancel")
    @Operation(summary = "Cancel a milestone")
    public ResponseEntity<Milestone> cancel(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String milestoneId) {
        return ResponseEntity.ok(milestoneService.cancel(tenantId, milestoneId));
    }
}
