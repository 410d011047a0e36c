package com.flagship.ledger_replay.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * A single typed transaction, ready for the ledger.
 *
 * Built once at the input boundary through the factory methods, which
 * guarantee that deposits and withdrawals always carry an amount and the
 * other three kinds never do.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Tx {
    TxType type;
    int client;
    long id;
    Money amount;

    public static Tx deposit(int client, long id, Money amount) {
        return new Tx(TxType.DEPOSIT, client, id, Objects.requireNonNull(amount, "amount"));
    }

    public static Tx withdrawal(int client, long id, Money amount) {
        return new Tx(TxType.WITHDRAWAL, client, id, Objects.requireNonNull(amount, "amount"));
    }

    public static Tx dispute(int client, long id) {
        return new Tx(TxType.DISPUTE, client, id, null);
    }

    public static Tx resolve(int client, long id) {
        return new Tx(TxType.RESOLVE, client, id, null);
    }

    public static Tx chargeback(int client, long id) {
        return new Tx(TxType.CHARGEBACK, client, id, null);
    }
}
