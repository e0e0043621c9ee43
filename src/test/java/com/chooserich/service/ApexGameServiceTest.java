package com.chooserich.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chooserich.dto.ApexResult;
import com.chooserich.model.ApexMode;
import com.chooserich.model.ApexSession;
import com.chooserich.model.Comparison;
import com.chooserich.model.GameKind;
import com.chooserich.model.LedgerTransaction;
import com.chooserich.model.SessionStatus;
import com.chooserich.model.TransactionKind;
import com.chooserich.repository.SessionStore;
import com.chooserich.support.InMemoryLedgerService;
import com.chooserich.support.ScriptedRandomSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApexGameServiceTest {

    private static final BigDecimal STAKE = new BigDecimal("10.00");

    private ScriptedRandomSource random;
    private InMemoryLedgerService ledger;
    private SessionStore store;
    private ApexGameService service;

    @BeforeEach
    void setUp() {
        random = new ScriptedRandomSource();
        ledger = new InMemoryLedgerService().fund("alice", "100.00");
        store = new SessionStore(new ObjectMapper(), Duration.ofMinutes(30));
        service = new ApexGameService(new ApexEngine(random, 0.01), store, new SettlementCoordinator(ledger, store));
    }

    private List<TransactionKind> kinds() {
        return ledger.records().stream().map(LedgerTransaction::kind).collect(Collectors.toList());
    }

    @Test
    void blindRoundIsSettledImmediately() {
        random.enqueue(4, 7);

        ApexGameService.Started started = service.start("alice", STAKE, ApexMode.BLIND);

        ApexResult result = started.blindResult();
        assertNotNull(result);
        assertTrue(result.won());
        assertEquals(new BigDecimal("22.00"), result.payout());
        assertEquals(new BigDecimal("112.00"), ledger.balance("alice"));
        assertEquals(List.of(TransactionKind.STAKE, TransactionKind.CASHOUT, TransactionKind.BET_WIN), kinds());

        ApexSession stored = service.find("alice", started.session().getId());
        assertEquals(SessionStatus.ENDED, stored.getStatus());
        assertEquals(Integer.valueOf(7), stored.getDrawnNumber());
    }

    @Test
    void lostBlindRoundKeepsTheStake() {
        random.enqueue(8, 2);

        ApexGameService.Started started = service.start("alice", STAKE, ApexMode.BLIND);

        assertEquals(new BigDecimal("0.00"), started.blindResult().payout());
        assertEquals(new BigDecimal("90.00"), ledger.balance("alice"));
        assertEquals(List.of(TransactionKind.STAKE, TransactionKind.BET_LOSS), kinds());
    }

    @Test
    void choiceRoundWaitsForTheComparison() {
        random.enqueue(3);

        ApexGameService.Started started = service.start("alice", STAKE, ApexMode.CHOICE);

        assertNull(started.blindResult());
        assertEquals(SessionStatus.ACTIVE, started.session().getStatus());
        assertEquals(new BigDecimal("90.00"), ledger.balance("alice"));

        random.enqueue(8);
        ApexResult result = service.choose("alice", started.session().getId(), Comparison.GREATER);

        assertEquals(new BigDecimal("16.50"), result.payout());
        assertEquals(new BigDecimal("106.50"), ledger.balance("alice"));
        assertEquals(SessionStatus.ENDED, service.find("alice", started.session().getId()).getStatus());
    }

    @Test
    void aResolvedRoundCannotBeChosenAgain() {
        random.enqueue(3, 1);
        String id = service.start("alice", STAKE, ApexMode.CHOICE).session().getId();
        service.choose("alice", id, Comparison.LESS);
        BigDecimal afterFirst = ledger.balance("alice");

        GameException e = assertThrows(GameException.class, () -> service.choose("alice", id, Comparison.LESS));

        assertEquals(ErrorKind.NOT_ACTIVE, e.getKind());
        assertEquals(afterFirst, ledger.balance("alice"));
    }

    @Test
    void impossibleComparisonKeepsTheRoundPlayable() {
        random.enqueue(0);
        String id = service.start("alice", STAKE, ApexMode.CHOICE).session().getId();

        assertEquals(ErrorKind.INVALID_MOVE, assertThrows(GameException.class,
                () -> service.choose("alice", id, Comparison.LESS)).getKind());
        assertEquals(SessionStatus.ACTIVE, service.find("alice", id).getStatus());

        random.enqueue(0);
        assertTrue(service.choose("alice", id, Comparison.EQUAL).won());
    }

    @Test
    void choosingInABlindRoundIsRejected() {
        random.enqueue(8, 2);
        String id = service.start("alice", STAKE, ApexMode.BLIND).session().getId();

        assertEquals(ErrorKind.NOT_ACTIVE, assertThrows(GameException.class,
                () -> service.choose("alice", id, Comparison.GREATER)).getKind());
    }

    @Test
    void startWithoutFundsLeavesNoRound() {
        random.enqueue(5, 6);

        GameException e = assertThrows(GameException.class,
                () -> service.start("alice", new BigDecimal("500.00"), ApexMode.BLIND));

        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, e.getKind());
        assertEquals(0, store.estimatedSize(GameKind.APEX));
        assertTrue(ledger.records().isEmpty());
    }

    @Test
    void missingModeIsAConfigurationError() {
        assertEquals(ErrorKind.INVALID_CONFIGURATION, assertThrows(GameException.class,
                () -> service.start("alice", STAKE, null)).getKind());
        assertEquals(new BigDecimal("100.00"), ledger.balance("alice"));
    }

    @Test
    void otherPlayersCannotResolveTheRound() {
        random.enqueue(4);
        String id = service.start("alice", STAKE, ApexMode.CHOICE).session().getId();

        assertEquals(ErrorKind.UNAUTHORIZED, assertThrows(GameException.class,
                () -> service.choose("mallory", id, Comparison.GREATER)).getKind());
        assertEquals(ErrorKind.UNAUTHORIZED, assertThrows(GameException.class,
                () -> service.find("mallory", id)).getKind());
        assertEquals(SessionStatus.ACTIVE, service.find("alice", id).getStatus());
    }
}
