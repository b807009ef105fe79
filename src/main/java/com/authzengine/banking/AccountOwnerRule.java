package com.authzengine.banking;

import com.authzengine.rules.AuthorizationResult;
import com.authzengine.rules.AuthorizationRule;
import com.authzengine.security.ClaimTypes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Rule that only lets the owner of an account close it.
 */
@Component
@RequiredArgsConstructor
public class AccountOwnerRule implements AuthorizationRule<CloseAccount> {

    private final AccountLedger accountLedger;

    @Override
    public AuthorizationResult evaluate(CloseAccount request) {
        String subject = request.getPrincipal().getClaimValue(ClaimTypes.SUBJECT);
        if (subject == null) {
            return AuthorizationResult.failure("Principal has no subject claim");
        }

        String owner = accountLedger.getOwner(request.getAccountId());
        if (!owner.equals(subject)) {
            return AuthorizationResult.failure(
                String.format("%s is not the owner of account %s", subject, request.getAccountId())
            );
        }

        return AuthorizationResult.success();
    }

    @Override
    public Class<CloseAccount> getRequestType() {
        return CloseAccount.class;
    }
}
