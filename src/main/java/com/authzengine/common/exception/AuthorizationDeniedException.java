package com.authzengine.common.exception;

/**
 * Thrown when an authorization is denied by a single rule.
 */
public class AuthorizationDeniedException extends AuthzEngineException {

    private final String denialReason;

    public AuthorizationDeniedException(String reason) {
        super(reason);
        this.denialReason = reason;
    }

    public String getDenialReason() {
        return denialReason;
    }
}
