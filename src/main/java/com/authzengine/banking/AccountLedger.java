package com.authzengine.banking;

import com.authzengine.common.Money;
import com.authzengine.common.exception.AccountNotFoundException;
import com.authzengine.common.exception.InsufficientFundsException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ledger of account owners and balances.
 */
@Component
@Slf4j
public class AccountLedger {

    private final Map<String, Entry> accounts = new ConcurrentHashMap<>();

    public void open(String accountId, String ownerId, Money openingBalance) {
        if (accountId == null || ownerId == null || openingBalance == null) {
            throw new IllegalArgumentException("Account id, owner and opening balance are required");
        }
        if (accounts.putIfAbsent(accountId, new Entry(ownerId, openingBalance)) != null) {
            throw new IllegalArgumentException("Account already exists: " + accountId);
        }
        log.info("Opened account {} for {} with {}", accountId, ownerId, openingBalance);
    }

    public Money getBalance(String accountId) {
        return find(accountId).getBalance();
    }

    public String getOwner(String accountId) {
        return find(accountId).getOwnerId();
    }

    public boolean exists(String accountId) {
        return accounts.containsKey(accountId);
    }

    /**
     * Take money out of an account. Callers authorize the withdrawal first;
     * the balance is checked again here, atomically with the update.
     *
     * @throws InsufficientFundsException if the balance no longer covers the amount
     */
    public Money debit(String accountId, Money amount) {
        Entry updated = accounts.computeIfPresent(accountId, (id, entry) -> {
            if (amount.isGreaterThan(entry.getBalance())) {
                throw new InsufficientFundsException(id, amount, entry.getBalance());
            }
            return new Entry(entry.getOwnerId(), entry.getBalance().subtract(amount));
        });
        if (updated == null) {
            throw new AccountNotFoundException(accountId);
        }
        return updated.getBalance();
    }

    public void close(String accountId) {
        if (accounts.remove(accountId) == null) {
            throw new AccountNotFoundException(accountId);
        }
        log.info("Closed account {}", accountId);
    }

    private Entry find(String accountId) {
        Entry entry = accounts.get(accountId);
        if (entry == null) {
            throw new AccountNotFoundException(accountId);
        }
        return entry;
    }

    @Value
    private static class Entry {
        String ownerId;
        Money balance;
    }
}
