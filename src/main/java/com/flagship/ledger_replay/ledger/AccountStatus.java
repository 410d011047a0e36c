package com.flagship.ledger_replay.ledger;

/**
 * Observable state of an account, derived from its balances and lock flag.
 */
public enum AccountStatus {
    /**
     * Unlocked with nothing held.
     */
    ACTIVE,

    /**
     * Unlocked with funds held by at least one open dispute.
     */
    DISPUTED,

    /**
     * Frozen by a chargeback. Deposits and withdrawals are rejected from here on.
     * Terminal state.
     */
    LOCKED
}
