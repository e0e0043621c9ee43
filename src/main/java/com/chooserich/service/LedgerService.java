package com.chooserich.service;

import com.chooserich.model.LedgerTransaction;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface LedgerService {
    /**
     * Atomically decrements the owner's balance if it covers the amount.
     *
     * @param owner  bettor identity
     * @param amount amount to take, strictly positive
     * @return true if the balance was decremented, false if it was insufficient
     */
    boolean debitIfAvailable(String owner, BigDecimal amount);

    /**
     * Adds funds to the owner's balance.
     *
     * @param owner  bettor identity
     * @param amount amount to add, strictly positive
     */
    void credit(String owner, BigDecimal amount);

    /**
     * Credits an external deposit and records it as {@code DEPOSIT}.
     *
     * @param owner  account holder
     * @param amount amount to add, strictly positive
     * @return the recorded transaction
     */
    LedgerTransaction deposit(String owner, BigDecimal amount);

    /**
     * Takes funds out of the game balance if it covers the amount, recording a {@code WITHDRAWAL}.
     *
     * @param owner  account holder
     * @param amount amount to take, strictly positive
     * @return the recorded transaction, or empty when the balance was insufficient
     */
    Optional<LedgerTransaction> withdraw(String owner, BigDecimal amount);

    /**
     * Appends an immutable record to the owner's transaction log.
     *
     * @param transaction record to append
     */
    void recordTransaction(LedgerTransaction transaction);

    /**
     * Current balance, zero for unknown owners.
     *
     * @param owner bettor identity
     * @return the balance
     */
    BigDecimal balance(String owner);

    /**
     * Newest-first transaction history.
     *
     * @param owner bettor identity
     * @param limit maximum number of records
     * @return the records, possibly empty
     */
    List<LedgerTransaction> transactions(String owner, int limit);
}
