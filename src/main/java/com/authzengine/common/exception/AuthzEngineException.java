package com.authzengine.common.exception;

/**
 * Base exception for all authz engine exceptions.
 */
public class AuthzEngineException extends RuntimeException {

    public AuthzEngineException(String message) {
        super(message);
    }
}
