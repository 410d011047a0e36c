package com.flagship.ledger_replay.ledger;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds every client account and the amounts of past deposits.
 *
 * A ledger lives for exactly one replay and is fed transactions in input
 * order by a single caller.
 *
 * Policies:
 * 1. Accounts are opened on first reference, by any kind of transaction
 *    that gets as far as touching an account
 * 2. Only deposits are remembered, so only deposits can be disputed
 * 3. Remembered amounts are never forgotten; a transaction may be disputed,
 *    resolved and disputed again
 * 4. A deposit reusing an id replaces the remembered amount
 */
@Slf4j
public class Ledger {

    private final Map<Integer, Account> accounts = new HashMap<>();
    private final Map<Long, Money> amounts = new HashMap<>();

    /**
     * Applies one transaction.
     *
     * @param tx The transaction to apply
     * @throws TransactionException if the transaction is rejected; no account is changed
     */
    public void process(Tx tx) throws TransactionException {
        switch (tx.getType()) {
            case DEPOSIT -> {
                account(tx.getClient()).deposit(tx.getAmount());
                amounts.put(tx.getId(), tx.getAmount());
            }
            case WITHDRAWAL -> account(tx.getClient()).withdraw(tx.getAmount());
            case DISPUTE -> {
                Money amount = referencedAmount(tx.getId());
                account(tx.getClient()).dispute(amount);
            }
            case RESOLVE -> {
                Money amount = referencedAmount(tx.getId());
                account(tx.getClient()).resolve(amount);
            }
            case CHARGEBACK -> {
                Money amount = referencedAmount(tx.getId());
                account(tx.getClient()).chargeback(amount);
            }
        }

        if (log.isDebugEnabled()) {
            Account account = accounts.get(tx.getClient());
            log.debug("Applied {} tx={}: {} status={}", tx.getType(), tx.getId(), account, account.getStatus());
        }
    }

    public Collection<Account> getAccounts() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    public Optional<Account> findAccount(int client) {
        return Optional.ofNullable(accounts.get(client));
    }

    /**
     * Amount remembered for a deposit id, if any.
     */
    public Optional<Money> findAmount(long id) {
        return Optional.ofNullable(amounts.get(id));
    }

    public int getAccountCount() {
        return accounts.size();
    }

    private Account account(int client) {
        return accounts.computeIfAbsent(client, Account::new);
    }

    private Money referencedAmount(long id) throws TransactionException {
        Money amount = amounts.get(id);
        if (amount == null) {
            throw new TransactionException(TxError.NO_SUCH_TRANSACTION);
        }
        return amount;
    }
}
