package com.flagship.budget_ledger.exception;

/**
 * A requested party, account, budget or transaction does not exist
 * (or is not visible to the acting user).
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String resource, Object id) {
        return new NotFoundException(resource + " not found: " + id);
    }
}
