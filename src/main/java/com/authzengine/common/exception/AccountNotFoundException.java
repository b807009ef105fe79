package com.authzengine.common.exception;

/**
 * Thrown when an account is not found.
 */
public class AccountNotFoundException extends AuthzEngineException {

    public AccountNotFoundException(String accountId) {
        super("Account not found: " + accountId);
    }
}
