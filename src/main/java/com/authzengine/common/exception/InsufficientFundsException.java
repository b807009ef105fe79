package com.authzengine.common.exception;

import com.authzengine.common.Money;

/**
 * Thrown when an account has insufficient funds for a debit.
 */
public class InsufficientFundsException extends AuthzEngineException {

    public InsufficientFundsException(String accountId, Money required, Money available) {
        super(String.format("Insufficient funds in account %s. Required: %s, Available: %s",
            accountId, required, available));
    }
}
