package com.flagship.ledger_replay.ledger;

import lombok.Getter;

/**
 * Balance state of a single client.
 *
 * Key principles:
 * - Balances change only through the five operations below
 * - Each operation computes every new value before writing any of them,
 *   so a rejected operation leaves the account untouched
 * - available + held always fits in a {@link Money}
 * - Dispute, resolve and chargeback do not look at the lock flag;
 *   a chargeback is what sets it
 */
@Getter
public class Account {

    private final int clientId;
    private Money available = Money.ZERO;
    private Money held = Money.ZERO;
    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
    }

    /**
     * Total funds: available plus held.
     */
    public Money getTotal() {
        try {
            return available.add(held);
        } catch (TransactionException e) {
            throw new IllegalStateException("Account " + clientId + " total is not representable", e);
        }
    }

    public AccountStatus getStatus() {
        if (locked) {
            return AccountStatus.LOCKED;
        }
        return held.equals(Money.ZERO) ? AccountStatus.ACTIVE : AccountStatus.DISPUTED;
    }

    public void deposit(Money amount) throws TransactionException {
        checkUnlocked();
        Money newAvailable = available.add(amount);
        commit(newAvailable, held);
    }

    /**
     * Removes funds from the available balance.
     *
     * @throws TransactionException INSUFFICIENT_FUNDS if available would go below zero
     */
    public void withdraw(Money amount) throws TransactionException {
        checkUnlocked();
        Money newAvailable = available.subtract(amount);
        if (newAvailable.isNegative()) {
            throw new TransactionException(TxError.INSUFFICIENT_FUNDS);
        }
        commit(newAvailable, held);
    }

    /**
     * Moves a disputed amount from available to held.
     * Available may become negative here.
     */
    public void dispute(Money amount) throws TransactionException {
        Money newAvailable = available.subtract(amount);
        Money newHeld = held.add(amount);
        commit(newAvailable, newHeld);
    }

    public void resolve(Money amount) throws TransactionException {
        Money newAvailable = available.add(amount);
        Money newHeld = held.subtract(amount);
        commit(newAvailable, newHeld);
    }

    /**
     * Removes a disputed amount from held and locks the account for good.
     */
    public void chargeback(Money amount) throws TransactionException {
        Money newHeld = held.subtract(amount);
        commit(available, newHeld);
        locked = true;
    }

    private void checkUnlocked() throws TransactionException {
        if (locked) {
            throw new TransactionException(TxError.LOCKED_ACCOUNT);
        }
    }

    private void commit(Money newAvailable, Money newHeld) throws TransactionException {
        // total must stay representable
        newAvailable.add(newHeld);
        available = newAvailable;
        held = newHeld;
    }

    @Override
    public String toString() {
        return String.format("Account[client=%d, available=%s, held=%s, locked=%s]",
                clientId, available, held, locked);
    }
}
