package com.assuranceledger.common.exception;

/**
 * Thrown when an operation is not legal for the current status of an entity.
 */
public class InvalidStateException extends AssuranceLedgerException {

    private final String entityType;
    private final String entityId;
    private final String currentState;
    private final String operation;

    public InvalidStateException(String entityType, String entityId, String currentState, String operation) {
        super(String.format("Cannot perform operation '%s' on %s %s in state %s",
            operation, entityType, entityId, currentState));
        this.entityType = entityType;
        this.entityId = entityId;
        this.currentState = currentState;
        this.operation = operation;
    }

    public InvalidStateException(String entityType, String entityId, String currentState,
                                 String operation, String reason) {
        super(String.format("Cannot perform operation '%s' on %s %s in state %s: %s",
            operation, entityType, entityId, currentState, reason));
        this.entityType = entityType;
        this.entityId = entityId;
        this.currentState = currentState;
        this.operation = operation;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getOperation() {
        return operation;
    }
}
