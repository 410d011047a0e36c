package com.flagship.ledger_replay.record;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.ledger_replay.ledger.Money;
import com.flagship.ledger_replay.ledger.Tx;
import com.flagship.ledger_replay.ledger.TxType;
import com.flagship.ledger_replay.replay.ReplayErrorCode;
import com.flagship.ledger_replay.replay.ReplayException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One row of the input log, as read from CSV.
 *
 * Columns: {@code type,client,tx,amount}. The amount is kept as text so it
 * can be converted to {@link Money} without passing through a double.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"type", "client", "tx", "amount"})
public class TxRecord {

    static final int MAX_CLIENT_ID = 0xFFFF;
    static final long MAX_TX_ID = 0xFFFF_FFFFL;

    // digits allowed before the decimal point for a long of 1/10,000 units
    private static final int MAX_INTEGER_DIGITS = 15;

    private String type;
    private Integer client;
    private Long tx;
    private String amount;

    /**
     * Converts this row into a typed transaction.
     *
     * @return The transaction
     * @throws ReplayException MISSING_AMOUNT or INVALID_AMOUNT for a bad deposit/withdrawal
     *         amount; MALFORMED_RECORD for an unknown type or a bad client/tx id
     */
    public Tx toTx() {
        TxType txType = TxType.fromCode(type)
                .orElseThrow(() -> new ReplayException(ReplayErrorCode.MALFORMED_RECORD,
                        String.format("Unknown transaction type '%s'", type)));
        int clientId = requireClient();
        long txId = requireTx();
        // amount column is ignored for dispute, resolve and chargeback
        Money money = txType.carriesAmount() ? requireAmount() : null;

        return switch (txType) {
            case DEPOSIT -> Tx.deposit(clientId, txId, money);
            case WITHDRAWAL -> Tx.withdrawal(clientId, txId, money);
            case DISPUTE -> Tx.dispute(clientId, txId);
            case RESOLVE -> Tx.resolve(clientId, txId);
            case CHARGEBACK -> Tx.chargeback(clientId, txId);
        };
    }

    /**
     * Parses decimal text into a scaled amount.
     * Digits beyond the fourth fractional place are rounded half-up.
     */
    static Money parseAmount(String text) {
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new ReplayException(ReplayErrorCode.INVALID_AMOUNT,
                    String.format("Invalid amount '%s'", text), e);
        }

        if (decimal.precision() - decimal.scale() > MAX_INTEGER_DIGITS) {
            throw new ReplayException(ReplayErrorCode.INVALID_AMOUNT,
                    String.format("Amount '%s' is out of range", text));
        }

        try {
            long scaled = decimal.setScale(Money.FRACTION_DIGITS, RoundingMode.HALF_UP)
                    .unscaledValue()
                    .longValueExact();
            return Money.ofScaled(scaled);
        } catch (ArithmeticException e) {
            throw new ReplayException(ReplayErrorCode.INVALID_AMOUNT,
                    String.format("Amount '%s' is out of range", text), e);
        }
    }

    private Money requireAmount() {
        if (amount == null || amount.isBlank()) {
            throw new ReplayException(ReplayErrorCode.MISSING_AMOUNT);
        }
        return parseAmount(amount);
    }

    private int requireClient() {
        if (client == null || client < 0 || client > MAX_CLIENT_ID) {
            throw new ReplayException(ReplayErrorCode.MALFORMED_RECORD,
                    String.format("Client id %s is not in range 0..%d", client, MAX_CLIENT_ID));
        }
        return client;
    }

    private long requireTx() {
        if (tx == null || tx < 0 || tx > MAX_TX_ID) {
            throw new ReplayException(ReplayErrorCode.MALFORMED_RECORD,
                    String.format("Transaction id %s is not in range 0..%d", tx, MAX_TX_ID));
        }
        return tx;
    }
}
