package com.authzengine.banking;

import com.authzengine.rules.AuthorizationResult;
import com.authzengine.rules.AuthorizationRule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule that declines withdrawals from accounts flagged for fraud review.
 */
@Component
@Order(2)
public class FraudRule implements AuthorizationRule<Withdraw> {

    static final String FLAGGED_ACCOUNT = "flagged account";

    private final Set<String> flaggedAccounts;

    public FraudRule(@Value("${authz-engine.rules.fraud.flagged-accounts:}") String[] flaggedAccounts) {
        this.flaggedAccounts = Arrays.stream(flaggedAccounts)
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public AuthorizationResult evaluate(Withdraw request) {
        if (flaggedAccounts.contains(request.getAccountId())) {
            return AuthorizationResult.failure(FLAGGED_ACCOUNT);
        }
        return AuthorizationResult.success();
    }

    @Override
    public Class<Withdraw> getRequestType() {
        return Withdraw.class;
    }

    @Override
    public String getRuleName() {
        return "Fraud";
    }
}
