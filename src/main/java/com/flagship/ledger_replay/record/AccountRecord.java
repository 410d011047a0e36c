package com.flagship.ledger_replay.record;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.ledger_replay.ledger.Account;
import lombok.Value;

/**
 * One row of the output: the final state of an account.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountRecord {
    int client;
    String available;
    String held;
    String total;
    boolean locked;

    public static AccountRecord from(Account account) {
        return new AccountRecord(
            account.getClientId(),
            account.getAvailable().toText(),
            account.getHeld().toText(),
            account.getTotal().toText(),
            account.isLocked()
        );
    }
}
