package com.authzengine.banking;

import com.authzengine.rules.AuthorizationResult;
import com.authzengine.rules.AuthorizationRule;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that declines withdrawals larger than the account balance.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class BalanceRule implements AuthorizationRule<Withdraw> {

    static final String INSUFFICIENT_FUNDS = "insufficient funds";

    private final AccountLedger accountLedger;

    @Override
    public AuthorizationResult evaluate(Withdraw request) {
        // Unknown accounts throw: that is a malfunction, not a denial
        if (request.getAmount().isGreaterThan(accountLedger.getBalance(request.getAccountId()))) {
            return AuthorizationResult.failure(INSUFFICIENT_FUNDS);
        }
        return AuthorizationResult.success();
    }

    @Override
    public Class<Withdraw> getRequestType() {
        return Withdraw.class;
    }

    @Override
    public String getRuleName() {
        return "Balance";
    }
}
