package com.flagship.ledger_replay.ledger;

/**
 * Thrown when the ledger rejects a transaction.
 *
 * A rejected transaction leaves every account unchanged.
 */
public class TransactionException extends Exception {

    private final TxError error;

    public TransactionException(TxError error) {
        super(error.getMessage());
        this.error = error;
    }

    public TxError getError() {
        return error;
    }
}
