package com.flagship.ledger_replay.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Account state machine tests.
 *
 * These tests verify that:
 * - Each operation moves exactly the given amount between available and held
 * - Rejected operations leave every field unchanged
 * - A chargeback locks the account against deposits and withdrawals only
 */
class AccountTest {

    private Account account;

    private static Money money(long scaled) {
        return Money.ofScaled(scaled);
    }

    private void assertBalances(long available, long held, boolean locked) {
        assertEquals(money(available), account.getAvailable(), "available");
        assertEquals(money(held), account.getHeld(), "held");
        assertEquals(money(available + held), account.getTotal(), "total");
        assertEquals(locked, account.isLocked(), "locked");
    }

    @BeforeEach
    void setUp() {
        account = new Account(7);
    }

    @Test
    @DisplayName("New account is empty and active")
    void testNewAccount() {
        assertEquals(7, account.getClientId());
        assertBalances(0, 0, false);
        assertEquals(AccountStatus.ACTIVE, account.getStatus());
    }

    @Nested
    @DisplayName("Deposit and withdrawal")
    class DepositWithdraw {

        @Test
        @DisplayName("Deposit into a fresh account makes the amount available")
        void testDeposit() throws TransactionException {
            account.deposit(money(50_000));

            assertBalances(50_000, 0, false);
        }

        @Test
        @DisplayName("Withdrawal of the full balance is allowed")
        void testWithdrawAll() throws TransactionException {
            account.deposit(money(50_000));

            account.withdraw(money(50_000));

            assertBalances(0, 0, false);
        }

        @Test
        @DisplayName("Withdrawal beyond available is rejected and changes nothing")
        void testInsufficientFunds() throws TransactionException {
            account.deposit(money(10_000));

            TransactionException e = assertThrows(TransactionException.class,
                () -> account.withdraw(money(10_001)));

            assertEquals(TxError.INSUFFICIENT_FUNDS, e.getError());
            assertBalances(10_000, 0, false);
        }

        @Test
        @DisplayName("Deposit that would overflow is rejected and changes nothing")
        void testDepositOverflow() throws TransactionException {
            account.deposit(money(Long.MAX_VALUE));

            TransactionException e = assertThrows(TransactionException.class,
                () -> account.deposit(money(1)));

            assertEquals(TxError.OVERFLOW, e.getError());
            assertEquals(money(Long.MAX_VALUE), account.getAvailable());
        }

        @Test
        @DisplayName("Deposit is rejected when available + held would not fit")
        void testDepositTotalOverflow() throws TransactionException {
            account.deposit(money(Long.MAX_VALUE));
            account.dispute(money(Long.MAX_VALUE));
            // available is now 0 and held is MAX

            TransactionException e = assertThrows(TransactionException.class,
                () -> account.deposit(money(1)));

            assertEquals(TxError.OVERFLOW, e.getError());
            assertEquals(Money.ZERO, account.getAvailable());
            assertEquals(money(Long.MAX_VALUE), account.getHeld());
        }
    }

    @Nested
    @DisplayName("Dispute lifecycle")
    class DisputeLifecycle {

        @BeforeEach
        void fund() throws TransactionException {
            account.deposit(money(50_000));
        }

        @Test
        @DisplayName("Dispute moves the amount to held and keeps the total")
        void testDispute() throws TransactionException {
            account.dispute(money(20_000));

            assertBalances(30_000, 20_000, false);
            assertEquals(AccountStatus.DISPUTED, account.getStatus());
        }

        @Test
        @DisplayName("Dispute may drive available below zero")
        void testDisputeAfterWithdrawal() throws TransactionException {
            account.withdraw(money(40_000));

            account.dispute(money(50_000));

            assertBalances(-40_000, 50_000, false);
        }

        @Test
        @DisplayName("Resolve reverses a dispute exactly")
        void testResolve() throws TransactionException {
            account.dispute(money(20_000));

            account.resolve(money(20_000));

            assertBalances(50_000, 0, false);
            assertEquals(AccountStatus.ACTIVE, account.getStatus());
        }

        @Test
        @DisplayName("Chargeback removes held funds and locks the account")
        void testChargeback() throws TransactionException {
            account.dispute(money(20_000));

            account.chargeback(money(20_000));

            assertBalances(30_000, 0, true);
            assertEquals(AccountStatus.LOCKED, account.getStatus());
        }

        @Test
        @DisplayName("Locked account rejects deposits and withdrawals")
        void testLockedAccount() throws TransactionException {
            account.dispute(money(20_000));
            account.chargeback(money(20_000));

            TransactionException deposit = assertThrows(TransactionException.class,
                () -> account.deposit(money(1)));
            TransactionException withdraw = assertThrows(TransactionException.class,
                () -> account.withdraw(money(1)));

            assertEquals(TxError.LOCKED_ACCOUNT, deposit.getError());
            assertEquals(TxError.LOCKED_ACCOUNT, withdraw.getError());
            assertBalances(30_000, 0, true);
        }

        @Test
        @DisplayName("Locked account still accepts dispute operations")
        void testLockedAccountDispute() throws TransactionException {
            account.dispute(money(20_000));
            account.chargeback(money(20_000));

            account.dispute(money(10_000));
            account.resolve(money(10_000));

            assertBalances(30_000, 0, true);
        }

        @Test
        @DisplayName("Failed chargeback does not lock the account")
        void testChargebackOverflow() throws TransactionException {
            account.dispute(money(20_000));

            TransactionException e = assertThrows(TransactionException.class,
                () -> account.chargeback(money(Long.MIN_VALUE)));

            assertEquals(TxError.OVERFLOW, e.getError());
            assertBalances(30_000, 20_000, false);
        }
    }
}
