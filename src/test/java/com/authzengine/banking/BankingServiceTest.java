package com.authzengine.banking;

import com.authzengine.authorization.AuthorizationOutcome;
import com.authzengine.authorization.OutcomeStatus;
import com.authzengine.common.Currency;
import com.authzengine.common.Money;
import com.authzengine.common.exception.AccountNotFoundException;
import com.authzengine.common.exception.AuthorizationDeniedException;
import com.authzengine.security.ClaimTypes;
import com.authzengine.security.ClaimsPrincipal;
import com.authzengine.security.Claim;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for withdrawals and closures through the wired engine.
 *
 * The test profile flags account "acc-flagged" for fraud review.
 */
@SpringBootTest
@ActiveProfiles("test")
class BankingServiceTest {

    @Autowired
    private BankingService bankingService;

    @Autowired
    private AccountLedger accountLedger;

    private String accountId;

    @BeforeEach
    void setUp() {
        // Create test account with $200
        accountId = "acc-" + UUID.randomUUID();
        accountLedger.open(accountId, "alice", Money.of("200.00", Currency.USD));
        if (!accountLedger.exists("acc-flagged")) {
            accountLedger.open("acc-flagged", "mallory", Money.of("200.00", Currency.USD));
        }
    }

    @Test
    void testWithdraw_Approved() {
        AuthorizationOutcome outcome = bankingService.withdraw(withdraw(accountId, "50.00"));

        assertTrue(outcome.isAllowed());
        assertEquals(Money.of("150.00", Currency.USD), accountLedger.getBalance(accountId));
    }

    @Test
    void testWithdraw_InsufficientFunds_SingleDenial() {
        AuthorizationOutcome outcome = bankingService.withdraw(withdraw(accountId, "500.00"));

        assertEquals(OutcomeStatus.DENIED, outcome.getStatus());
        assertEquals("insufficient funds", outcome.getReason());
        // Denied withdrawals leave the balance untouched
        assertEquals(Money.of("200.00", Currency.USD), accountLedger.getBalance(accountId));
    }

    @Test
    void testWithdraw_FlaggedAndInsufficient_AggregateDenial() {
        AuthorizationOutcome outcome = bankingService.withdraw(withdraw("acc-flagged", "500.00"));

        assertEquals(OutcomeStatus.DENIED_MULTIPLE, outcome.getStatus());
        assertEquals(List.of("insufficient funds", "flagged account"), outcome.getReasons());
    }

    @Test
    void testWithdraw_UnknownAccount_Propagates() {
        assertThrows(AccountNotFoundException.class,
            () -> bankingService.withdraw(withdraw("acc-missing", "10.00")));
    }

    @Test
    void testWithdraw_NonPositiveAmountRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> bankingService.withdraw(withdraw(accountId, "0.00")));
    }

    @Test
    void testWithdraw_MissingRequestOrAccountRejected() {
        IllegalArgumentException nullRequest = assertThrows(IllegalArgumentException.class,
            () -> bankingService.withdraw(null));
        assertTrue(nullRequest.getMessage().contains("request"));

        IllegalArgumentException nullAccount = assertThrows(IllegalArgumentException.class,
            () -> bankingService.withdraw(withdraw(null, "10.00")));
        assertTrue(nullAccount.getMessage().contains("account"));

        assertThrows(IllegalArgumentException.class,
            () -> bankingService.withdraw(Withdraw.builder().accountId(accountId).build()));
    }

    @Test
    void testViewProfile_NoRules_Allowed() {
        assertTrue(bankingService.canViewProfile("profile-1"));
    }

    @Test
    void testCloseAccount_Owner() {
        bankingService.closeAccount(ClaimsPrincipal.of(Claim.of(ClaimTypes.SUBJECT, "alice")), accountId);

        assertFalse(accountLedger.exists(accountId));
    }

    @Test
    void testCloseAccount_NotOwner_Denied() {
        ClaimsPrincipal bob = ClaimsPrincipal.of(Claim.of(ClaimTypes.SUBJECT, "bob"));

        AuthorizationDeniedException thrown = assertThrows(AuthorizationDeniedException.class,
            () -> bankingService.closeAccount(bob, accountId));

        assertTrue(thrown.getDenialReason().contains("not the owner"));
        assertTrue(accountLedger.exists(accountId));
    }

    @Test
    void testCloseAccount_AnonymousPrincipal_Denied() {
        assertThrows(AuthorizationDeniedException.class,
            () -> bankingService.closeAccount(ClaimsPrincipal.anonymous(), accountId));
    }

    private static Withdraw withdraw(String accountId, String amount) {
        return Withdraw.builder()
            .accountId(accountId)
            .amount(Money.of(amount, Currency.USD))
            .build();
    }
}
