package com.flagship.ledger_replay.ledger;

/**
 * Reasons a single transaction can be rejected by the ledger.
 *
 * None of these stop a replay; the failing transaction is skipped
 * and the account state is left exactly as it was.
 */
public enum TxError {
    INSUFFICIENT_FUNDS("Insufficient funds"),
    LOCKED_ACCOUNT("Locked account"),
    NO_SUCH_TRANSACTION("Referenced transaction not found"),
    OVERFLOW("Numerical overflow");

    private final String message;

    TxError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
