package com.assuranceledger.common.exception;

/**
 * Thrown when an entity does not exist within the caller's tenant.
 */
public class NotFoundException extends AssuranceLedgerException {

    public NotFoundException(String entityType, String id) {
        super(entityType + " not found: " + id);
    }
}
