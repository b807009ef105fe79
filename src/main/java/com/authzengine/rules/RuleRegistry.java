package com.authzengine.rules;

import java.util.List;

/**
 * Lookup of the rules registered for a request type.
 */
public interface RuleRegistry {

    /**
     * Resolve the rules registered for exactly the given request type.
     *
     * @param requestType the request type, never null
     * @return the registered rules in registration order; empty when none are registered
     * @throws IllegalArgumentException if {@code requestType} is null
     */
    <T> List<AuthorizationRule<T>> resolveRules(Class<T> requestType);
}
