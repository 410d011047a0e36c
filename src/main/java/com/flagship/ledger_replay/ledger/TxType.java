package com.flagship.ledger_replay.ledger;

import java.util.Arrays;
import java.util.Optional;

/**
 * The five kinds of transaction the ledger understands.
 *
 * Deposits and withdrawals move money and own a fresh transaction id.
 * Disputes, resolves and chargebacks reference the id of an earlier deposit.
 */
public enum TxType {
    DEPOSIT("deposit", true),
    WITHDRAWAL("withdrawal", true),
    DISPUTE("dispute", false),
    RESOLVE("resolve", false),
    CHARGEBACK("chargeback", false);

    private final String code;
    private final boolean carriesAmount;

    TxType(String code, boolean carriesAmount) {
        this.code = code;
        this.carriesAmount = carriesAmount;
    }

    /**
     * Name used in the input log, e.g. {@code "withdrawal"}.
     */
    public String getCode() {
        return code;
    }

    public boolean carriesAmount() {
        return carriesAmount;
    }

    public static Optional<TxType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
