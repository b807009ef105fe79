package com.authzengine.banking;

import com.authzengine.security.ClaimsPrincipal;
import lombok.Value;

/**
 * Request by a principal to close an account.
 */
@Value
public class CloseAccount {
    ClaimsPrincipal principal;
    String accountId;
}
