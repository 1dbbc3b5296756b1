package com.assuranceledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Assurance Ledger.
 *
 * Holds money against conditional commitments: contracts define obligations and milestones,
 * a secured balance ledger records funding, and held funds are released, forfeited or refunded
 * as milestones become ready and claims are settled.
 */
@SpringBootApplication
public class AssuranceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssuranceLedgerApplication.class, args);
    }
}
