package com.assuranceledger.claims;

import com.assuranceledger.contracts.CommitmentContract;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether pending claims block milestone releases, per the contract's freeze policy.
 */
@Component
@RequiredArgsConstructor
public class ClaimFreezeGuard {

    private final ClaimRepository claimRepository;

    /**
     * The pending claim freezing releases of {@code milestoneId}, if any.
     */
    public Optional<Claim> findFreezingClaim(CommitmentContract contract, String milestoneId) {
        return switch (contract.getClaimFreezePolicy()) {
            case NONE -> Optional.empty();
            case FREEZE_ALL -> claimRepository
                .findByTenantIdAndContractIdAndStatusIn(contract.getTenantId(), contract.getId(),
                    ClaimStatus.pendingStatuses())
                .stream()
                .findFirst();
            case FREEZE_DISPUTED_MILESTONE -> claimRepository
                .findByTenantIdAndContractIdAndStatusIn(contract.getTenantId(), contract.getId(),
                    ClaimStatus.pendingStatuses())
                .stream()
                .filter(claim -> milestoneId != null && milestoneId.equals(claim.getMilestoneId()))
                .findFirst();
        };
    }
}
