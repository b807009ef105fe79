package com.authzengine.authorization;

import com.authzengine.common.exception.AuthorizationDeniedException;
import com.authzengine.common.exception.MultipleAuthorizationDeniedException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Aggregated result of evaluating every rule registered for a request.
 *
 * One of:
 * - ALLOWED: no rule failed (no reasons)
 * - DENIED: exactly one rule failed (one reason)
 * - DENIED_MULTIPLE: two or more rules failed (all reasons, in evaluation order)
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationOutcome {

    private static final AuthorizationOutcome ALLOWED = new AuthorizationOutcome(OutcomeStatus.ALLOWED, List.of());

    OutcomeStatus status;
    List<String> reasons;

    public static AuthorizationOutcome allowed() {
        return ALLOWED;
    }

    public static AuthorizationOutcome denied(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A denial requires a reason");
        }
        return new AuthorizationOutcome(OutcomeStatus.DENIED, List.of(reason));
    }

    public static AuthorizationOutcome deniedMultiple(List<String> reasons) {
        if (reasons == null || reasons.size() < 2) {
            throw new IllegalArgumentException("An aggregate denial requires at least two reasons");
        }
        return new AuthorizationOutcome(OutcomeStatus.DENIED_MULTIPLE, List.copyOf(reasons));
    }

    /**
     * Build the outcome matching a list of failure messages.
     *
     * @param failures failure messages in evaluation order
     */
    public static AuthorizationOutcome fromFailures(List<String> failures) {
        return switch (failures.size()) {
            case 0 -> allowed();
            case 1 -> denied(failures.get(0));
            default -> deniedMultiple(failures);
        };
    }

    public boolean isAllowed() {
        return status == OutcomeStatus.ALLOWED;
    }

    /**
     * True for both the single and the aggregate denial.
     */
    public boolean isDenied() {
        return !isAllowed();
    }

    /**
     * The denial reason. For an aggregate denial this is a summary line;
     * use {@link #getReasons()} for the individual messages.
     *
     * @return the reason, or null when allowed
     */
    public String getReason() {
        return switch (status) {
            case DENIED -> reasons.get(0);
            case DENIED_MULTIPLE -> MultipleAuthorizationDeniedException.MESSAGE;
            case ALLOWED -> null;
        };
    }

    /**
     * Signal a denial the exception way.
     *
     * @throws AuthorizationDeniedException when exactly one rule failed
     * @throws MultipleAuthorizationDeniedException when several rules failed
     */
    public void throwIfDenied() {
        switch (status) {
            case DENIED -> throw new AuthorizationDeniedException(reasons.get(0));
            case DENIED_MULTIPLE -> throw new MultipleAuthorizationDeniedException(reasons);
            case ALLOWED -> {
            }
        }
    }
}
