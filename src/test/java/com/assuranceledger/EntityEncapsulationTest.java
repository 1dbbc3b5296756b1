package com.assuranceledger;

import com.assuranceledger.claims.Claim;
import com.assuranceledger.claims.ClaimEvent;
import com.assuranceledger.ledger.LedgerEntry;
import com.assuranceledger.ledger.SecuredBalanceAccount;
import com.assuranceledger.milestones.Milestone;
import com.assuranceledger.obligations.Obligation;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State-machine entities change only through their transition methods, which record timestamps
 * and claim events.
 */
class EntityEncapsulationTest {

    @Test
    void testStateMachineEntitiesExposeNoSetters() {
        for (Class<?> entity : List.of(Milestone.class, Obligation.class, Claim.class, ClaimEvent.class,
                LedgerEntry.class, SecuredBalanceAccount.class)) {
            for (Method method : entity.getMethods()) {
                assertFalse(method.getName().startsWith("set"),
                    entity.getSimpleName() + " exposes " + method.getName());
            }
        }
    }
}
