package com.authzengine.rules;

/**
 * Interface for authorization rules.
 *
 * Each rule is registered against exactly one request type and evaluates
 * requests of that type, returning a result indicating whether the request
 * passes the rule. A rule for type A never applies to a request of type B,
 * even when B extends A.
 *
 * A denial is expressed by returning {@link AuthorizationResult#failure(String)},
 * never by throwing. Exceptions are reserved for malfunctions (for example an
 * unreachable policy store) and are propagated to the caller unchanged.
 *
 * @param <T> the request type this rule accepts
 */
public interface AuthorizationRule<T> {

    /**
     * Evaluate the rule against an authorization request.
     * Implementations may block, e.g. on a remote lookup.
     *
     * @param request the authorization request to evaluate, never null
     * @return the result of the rule evaluation, never null
     */
    AuthorizationResult evaluate(T request);

    /**
     * The exact request type this rule is registered against.
     */
    Class<T> getRequestType();

    /**
     * Get the name of this rule.
     */
    default String getRuleName() {
        return getClass().getSimpleName();
    }
}
