package com.chooserich.service;

import com.chooserich.model.LedgerTransaction;
import com.chooserich.model.TransactionKind;
import com.chooserich.repository.AccountRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class RedisLedgerService implements LedgerService {

    private static final Logger LOG = Logger.getLogger(RedisLedgerService.class);

    private final AccountRepository accountRepository;
    private final ObjectMapper objectMapper;

    // Per-owner monitor around read-check-write of the balance.
    // Only holds with a single backend instance; scaling out needs a Redis-side lock or script.
    // Weak values: a monitor is dropped once no thread holds it.
    private final Cache<String, Object> ownerLocks = Caffeine.newBuilder().weakValues().build();

    @Inject
    public RedisLedgerService(AccountRepository accountRepository, ObjectMapper objectMapper) {
        this.accountRepository = accountRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean debitIfAvailable(String owner, BigDecimal amount) {
        requirePositive(amount);
        synchronized (lockFor(owner)) {
            BigDecimal balance = accountRepository.findBalance(owner).orElse(BigDecimal.ZERO);
            if (balance.compareTo(amount) < 0) {
                LOG.info("Debit refused for " + owner + ": balance " + balance + " < " + amount);
                return false;
            }
            BigDecimal newBalance = balance.subtract(amount);
            accountRepository.saveBalance(owner, newBalance);
            LOG.info("Debited " + amount + " from " + owner + ". New balance: " + newBalance);
            return true;
        }
    }

    @Override
    public void credit(String owner, BigDecimal amount) {
        requirePositive(amount);
        synchronized (lockFor(owner)) {
            BigDecimal balance = accountRepository.findBalance(owner).orElse(BigDecimal.ZERO);
            BigDecimal newBalance = balance.add(amount);
            accountRepository.saveBalance(owner, newBalance);
            LOG.info("Credited " + amount + " to " + owner + ". New balance: " + newBalance);
        }
    }

    @Override
    public LedgerTransaction deposit(String owner, BigDecimal amount) {
        credit(owner, amount);
        LedgerTransaction transaction = walletTransaction(owner, TransactionKind.DEPOSIT, amount,
                "Deposit to game account");
        recordTransaction(transaction);
        return transaction;
    }

    @Override
    public Optional<LedgerTransaction> withdraw(String owner, BigDecimal amount) {
        if (!debitIfAvailable(owner, amount)) {
            return Optional.empty();
        }
        LedgerTransaction transaction = walletTransaction(owner, TransactionKind.WITHDRAWAL, amount,
                "Withdrawal from game account");
        recordTransaction(transaction);
        return Optional.of(transaction);
    }

    @Override
    public void recordTransaction(LedgerTransaction transaction) {
        try {
            accountRepository.appendTransaction(transaction.owner(), objectMapper.writeValueAsString(transaction));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize transaction " + transaction.id(), e);
        }
    }

    @Override
    public BigDecimal balance(String owner) {
        return accountRepository.findBalance(owner).orElse(BigDecimal.ZERO);
    }

    @Override
    public List<LedgerTransaction> transactions(String owner, int limit) {
        List<LedgerTransaction> result = new ArrayList<>();
        for (String json : accountRepository.findTransactions(owner, limit)) {
            try {
                result.add(objectMapper.readValue(json, LedgerTransaction.class));
            } catch (JsonProcessingException e) {
                LOG.error("Skipping unreadable transaction record for " + owner, e);
            }
        }
        return result;
    }

    Object lockFor(String owner) {
        return ownerLocks.get(owner, k -> new Object());
    }

    private static LedgerTransaction walletTransaction(String owner, TransactionKind kind, BigDecimal amount,
            String description) {
        return new LedgerTransaction(UUID.randomUUID().toString(), owner, kind, amount, null, null, description,
                System.currentTimeMillis());
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }
}
