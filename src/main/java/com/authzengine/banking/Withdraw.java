package com.authzengine.banking;

import com.authzengine.common.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Request to withdraw money from an account.
 */
@Value
@Builder
public class Withdraw {

    /**
     * Account the money is taken from.
     */
    String accountId;

    /**
     * Amount to withdraw.
     */
    Money amount;
}
