package com.authzengine.rules;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a single rule evaluation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationResult {

    private static final AuthorizationResult SUCCESS = new AuthorizationResult(true, null);

    boolean successful;
    String message;

    public static AuthorizationResult success() {
        return SUCCESS;
    }

    public static AuthorizationResult success(String message) {
        return new AuthorizationResult(true, message);
    }

    public static AuthorizationResult failure(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("A failed authorization result requires a message");
        }
        return new AuthorizationResult(false, message);
    }
}
