package com.authzengine.common.exception;

import java.util.List;

/**
 * Thrown when an authorization is denied by more than one rule.
 *
 * Every individual denial is attached as a suppressed
 * {@link AuthorizationDeniedException}, in evaluation order.
 */
public class MultipleAuthorizationDeniedException extends AuthzEngineException {

    public static final String MESSAGE =
        "Multiple authorization rules broken. See suppressed exceptions for details.";

    private final List<String> reasons;

    public MultipleAuthorizationDeniedException(List<String> reasons) {
        super(MESSAGE);
        this.reasons = List.copyOf(reasons);
        this.reasons.forEach(reason -> addSuppressed(new AuthorizationDeniedException(reason)));
    }

    public List<String> getReasons() {
        return reasons;
    }
}
