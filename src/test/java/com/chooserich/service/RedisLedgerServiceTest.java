package com.chooserich.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chooserich.model.GameKind;
import com.chooserich.model.LedgerTransaction;
import com.chooserich.model.TransactionKind;
import com.chooserich.repository.AccountRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RedisLedgerServiceTest {

    private final Map<String, BigDecimal> balances = new ConcurrentHashMap<>();
    private final List<String> rawTransactions = Collections.synchronizedList(new ArrayList<>());
    private AccountRepository repository;
    private RedisLedgerService ledger;

    @BeforeEach
    void setUp() {
        repository = mock(AccountRepository.class);
        when(repository.findBalance(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(balances.get(inv.<String>getArgument(0))));
        doAnswer(inv -> {
            // widen the read-modify-write window so unsynchronized callers would collide
            Thread.sleep(1);
            balances.put(inv.getArgument(0), inv.getArgument(1));
            return null;
        }).when(repository).saveBalance(anyString(), any());
        doAnswer(inv -> {
            rawTransactions.add(0, inv.getArgument(1));
            return null;
        }).when(repository).appendTransaction(anyString(), anyString());
        when(repository.findTransactions(anyString(), anyInt())).thenAnswer(inv -> {
            int limit = inv.getArgument(1);
            return new ArrayList<>(rawTransactions.subList(0, Math.min(limit, rawTransactions.size())));
        });
        ledger = new RedisLedgerService(repository, new ObjectMapper());
    }

    @Test
    void unknownAccountsHaveZeroBalance() {
        assertEquals(BigDecimal.ZERO, ledger.balance("nobody"));
        assertFalse(ledger.debitIfAvailable("nobody", new BigDecimal("0.01")));
        verify(repository, never()).saveBalance(anyString(), any());
    }

    @Test
    void debitSucceedsOnlyWhenCovered() {
        balances.put("alice", new BigDecimal("10.00"));

        assertTrue(ledger.debitIfAvailable("alice", new BigDecimal("10.00")));
        assertEquals(new BigDecimal("0.00"), ledger.balance("alice"));
        assertFalse(ledger.debitIfAvailable("alice", new BigDecimal("0.01")));
    }

    @Test
    void creditAddsToTheBalance() {
        balances.put("alice", new BigDecimal("1.50"));

        ledger.credit("alice", new BigDecimal("2.25"));

        assertEquals(new BigDecimal("3.75"), ledger.balance("alice"));
    }

    @Test
    void nonPositiveAmountsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ledger.credit("alice", BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> ledger.debitIfAvailable("alice", new BigDecimal("-1")));
    }

    @Test
    void concurrentDebitsNeverOverdraw() throws Exception {
        balances.put("alice", new BigDecimal("10.00"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                attempts.add(pool.submit(() -> {
                    go.await();
                    return ledger.debitIfAvailable("alice", new BigDecimal("1.00"));
                }));
            }
            go.countDown();

            int succeeded = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) {
                    succeeded++;
                }
            }
            assertEquals(10, succeeded);
            assertEquals(new BigDecimal("0.00"), ledger.balance("alice"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void transactionsAreReturnedNewestFirstAndLimited() {
        for (int i = 1; i <= 3; i++) {
            ledger.recordTransaction(new LedgerTransaction("tx-" + i, "alice", TransactionKind.STAKE,
                    new BigDecimal("1.00"), GameKind.MINES, "m-" + i, "Mines game bet", i));
        }

        List<LedgerTransaction> latest = ledger.transactions("alice", 2);

        assertEquals(2, latest.size());
        assertEquals("tx-3", latest.get(0).id());
        assertEquals("tx-2", latest.get(1).id());
        assertEquals(TransactionKind.STAKE, latest.get(0).kind());
        assertEquals(new BigDecimal("1.00"), latest.get(0).amount());
    }

    @Test
    void unreadableRecordsAreSkipped() {
        rawTransactions.add("{not json");
        ledger.recordTransaction(new LedgerTransaction("tx-1", "alice", TransactionKind.REFUND,
                new BigDecimal("5.00"), GameKind.APEX, "a-1", "Refund", 1L));

        List<LedgerTransaction> all = ledger.transactions("alice", 50);

        assertEquals(1, all.size());
        assertEquals("tx-1", all.get(0).id());
    }

    @Test
    void depositCreditsAndRecordsTheTransaction() {
        LedgerTransaction deposit = ledger.deposit("carol", new BigDecimal("25.00"));

        assertEquals(new BigDecimal("25.00"), ledger.balance("carol"));
        assertEquals(TransactionKind.DEPOSIT, deposit.kind());
        assertEquals(new BigDecimal("25.00"), deposit.amount());
        assertNull(deposit.gameKind());
        assertNull(deposit.sessionId());

        List<LedgerTransaction> history = ledger.transactions("carol", 10);
        assertEquals(1, history.size());
        assertEquals(deposit.id(), history.get(0).id());
        assertEquals(TransactionKind.DEPOSIT, history.get(0).kind());
    }

    @Test
    void depositedFundsCanBeStaked() {
        ledger.deposit("carol", new BigDecimal("5.00"));

        assertTrue(ledger.debitIfAvailable("carol", new BigDecimal("5.00")));
        assertEquals(new BigDecimal("0.00"), ledger.balance("carol"));
    }

    @Test
    void withdrawTakesCoveredAmountsAndRecordsThem() {
        balances.put("alice", new BigDecimal("10.00"));

        LedgerTransaction withdrawal = ledger.withdraw("alice", new BigDecimal("4.00")).orElseThrow();

        assertEquals(new BigDecimal("6.00"), ledger.balance("alice"));
        assertEquals(TransactionKind.WITHDRAWAL, withdrawal.kind());
        assertEquals(new BigDecimal("4.00"), withdrawal.amount());
        assertEquals(TransactionKind.WITHDRAWAL, ledger.transactions("alice", 10).get(0).kind());
    }

    @Test
    void withdrawBeyondTheBalanceChangesNothing() {
        balances.put("alice", new BigDecimal("3.00"));

        assertTrue(ledger.withdraw("alice", new BigDecimal("3.01")).isEmpty());

        assertEquals(new BigDecimal("3.00"), ledger.balance("alice"));
        assertTrue(ledger.transactions("alice", 10).isEmpty());
    }

    @Test
    void concurrentWithdrawalsNeverOverdraw() throws Exception {
        balances.put("alice", new BigDecimal("5.00"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 12; i++) {
                attempts.add(pool.submit(() -> {
                    go.await();
                    return ledger.withdraw("alice", new BigDecimal("1.00")).isPresent();
                }));
            }
            go.countDown();

            int succeeded = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) {
                    succeeded++;
                }
            }
            assertEquals(5, succeeded);
            assertEquals(new BigDecimal("0.00"), ledger.balance("alice"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void sameOwnerSharesOneLockWhileItIsHeld() {
        Object first = ledger.lockFor("alice");

        assertSame(first, ledger.lockFor("alice"));
    }
}
