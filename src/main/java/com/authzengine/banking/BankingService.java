package com.authzengine.banking;

import com.authzengine.authorization.AuthorizationEngine;
import com.authzengine.authorization.AuthorizationOutcome;
import com.authzengine.common.Money;
import com.authzengine.common.exception.InsufficientFundsException;
import com.authzengine.security.ClaimsPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Account operations guarded by the authorization engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankingService {

    private final AuthorizationEngine authorizationEngine;
    private final AccountLedger accountLedger;

    /**
     * Withdraw money if every withdrawal rule passes.
     *
     * @return the outcome; the ledger is only debited when it is allowed
     */
    public AuthorizationOutcome withdraw(Withdraw request) {
        if (request == null) {
            throw new IllegalArgumentException("Withdrawal request cannot be null");
        }
        if (request.getAccountId() == null || request.getAccountId().isBlank()) {
            throw new IllegalArgumentException("Withdrawal account id is required");
        }
        if (request.getAmount() == null || !request.getAmount().isPositive()) {
            throw new IllegalArgumentException("Withdrawal amount must be positive");
        }

        AuthorizationOutcome outcome = authorizationEngine.authorize(Withdraw.class, request);
        if (outcome.isDenied()) {
            log.info("Withdrawal of {} from {} DENIED: {}",
                request.getAmount(), request.getAccountId(), outcome.getReasons());
            return outcome;
        }

        try {
            Money remaining = accountLedger.debit(request.getAccountId(), request.getAmount());
            log.info("Withdrawal of {} from {} APPROVED, remaining balance {}",
                request.getAmount(), request.getAccountId(), remaining);
            return outcome;
        } catch (InsufficientFundsException e) {
            // Balance changed between the rules and the debit
            log.info("Withdrawal of {} from {} DENIED: {}",
                request.getAmount(), request.getAccountId(), e.getMessage());
            return AuthorizationOutcome.denied(BalanceRule.INSUFFICIENT_FUNDS);
        }
    }

    /**
     * Close an account on behalf of a principal.
     *
     * @throws com.authzengine.common.exception.AuthorizationDeniedException if a rule denies the closure
     */
    public void closeAccount(ClaimsPrincipal principal, String accountId) {
        authorizationEngine.authorize(CloseAccount.class, new CloseAccount(principal, accountId))
            .throwIfDenied();
        accountLedger.close(accountId);
    }

    /**
     * Profiles are readable by anyone: no rules are registered for {@link ViewProfile}.
     */
    public boolean canViewProfile(String profileId) {
        return authorizationEngine.authorize(ViewProfile.class, new ViewProfile(profileId)).isAllowed();
    }
}
