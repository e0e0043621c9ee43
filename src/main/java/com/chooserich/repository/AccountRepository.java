package com.chooserich.repository;

import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.hash.HashCommands;
import io.quarkus.redis.datasource.list.ListCommands;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Redis layout of the in-game ledger: one hash per account and one list of serialized transaction
 * records per account, newest first.
 */
@ApplicationScoped
public class AccountRepository {

    private static final String BALANCE_FIELD = "balance";

    private final HashCommands<String, String, String> hashCommands;
    private final ListCommands<String, String> listCommands;

    public AccountRepository(RedisDataSource ds) {
        this.hashCommands = ds.hash(String.class);
        this.listCommands = ds.list(String.class);
    }

    public Optional<BigDecimal> findBalance(String owner) {
        String raw = hashCommands.hget(accountKey(owner), BALANCE_FIELD);
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(raw));
    }

    public void saveBalance(String owner, BigDecimal balance) {
        hashCommands.hset(accountKey(owner), BALANCE_FIELD, balance.toPlainString());
    }

    public void appendTransaction(String owner, String json) {
        listCommands.lpush(transactionsKey(owner), json);
    }

    public List<String> findTransactions(String owner, int limit) {
        return listCommands.lrange(transactionsKey(owner), 0, limit - 1L);
    }

    private static String accountKey(String owner) {
        return "account:" + owner;
    }

    private static String transactionsKey(String owner) {
        return "ledger:tx:" + owner;
    }
}
