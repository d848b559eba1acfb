package com.flagship.expense_workflow.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised by the service layer when an id does not resolve in the store.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final UUID resourceId;

    public ResourceNotFoundException(String resourceType, UUID resourceId) {
        super(String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
