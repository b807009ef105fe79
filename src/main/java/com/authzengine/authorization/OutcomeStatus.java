package com.authzengine.authorization;

/**
 * Status of an aggregated authorization.
 */
public enum OutcomeStatus {
    /**
     * No rule failed, or no rule is registered for the request type.
     */
    ALLOWED,

    /**
     * Exactly one rule failed.
     */
    DENIED,

    /**
     * Two or more rules failed.
     */
    DENIED_MULTIPLE
}
