package com.flagship.budget_ledger.exception;

public class DuplicateResourceException extends IllegalStateException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
