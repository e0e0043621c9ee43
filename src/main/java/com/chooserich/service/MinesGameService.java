package com.chooserich.service;

import com.chooserich.dto.MinesCashoutResult;
import com.chooserich.dto.MinesMoveResult;
import com.chooserich.model.GameKind;
import com.chooserich.model.MinesSession;
import com.chooserich.repository.SessionStore;
import com.chooserich.repository.Versioned;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.util.Locale;

@ApplicationScoped
public class MinesGameService {

    private static final Logger LOG = Logger.getLogger(MinesGameService.class);

    private final MinesEngine engine;
    private final SessionStore sessionStore;
    private final SettlementCoordinator settlement;

    @Inject
    public MinesGameService(MinesEngine engine, SessionStore sessionStore, SettlementCoordinator settlement) {
        this.engine = engine;
        this.sessionStore = sessionStore;
        this.settlement = settlement;
    }

    public MinesSession start(String owner, BigDecimal stake, int blocks, int mines) {
        BigDecimal normalized = settlement.normalizeStake(stake);
        // reject bad boards before any money moves
        engine.validate(blocks, mines);

        MinesSession session = engine.create(normalized, blocks, mines, owner);
        settlement.open(session, "Mines game bet");
        LOG.info("Mines " + session.getId() + ": " + blocks + " blocks, " + mines + " mines");
        return session;
    }

    public MinesMoveResult move(String owner, String sessionId, int block) {
        Versioned<MinesSession> current = load(sessionId);
        MinesSession session = current.value();

        MinesMoveResult result = engine.reveal(session, block, owner);

        if (result.isBust()) {
            sessionStore.remove(GameKind.MINES, sessionId, current.version());
            LOG.info("Mines " + sessionId + ": " + owner + " hit a mine on block " + block);
            settlement.settle(session, result.finalPayout(), "Mines game bust on block " + block);
        } else {
            sessionStore.put(GameKind.MINES, sessionId, current.version(), session);
        }
        return result;
    }

    public MinesCashoutResult cashout(String owner, String sessionId) {
        Versioned<MinesSession> current = load(sessionId);
        MinesSession session = current.value();

        MinesCashoutResult result = engine.cashout(session, owner);

        // ENDED state stays readable until it expires
        sessionStore.put(GameKind.MINES, sessionId, current.version(), session);
        settlement.settle(session, result.finalPayout(),
                "Mines game cashout at " + String.format(Locale.ROOT, "%.4f", result.multiplier()) + "x");
        return result;
    }

    public MinesSession find(String owner, String sessionId) {
        MinesSession session = load(sessionId).value();
        if (!session.getOwner().equals(owner)) {
            throw GameException.unauthorized();
        }
        return session;
    }

    private Versioned<MinesSession> load(String sessionId) {
        return sessionStore.get(GameKind.MINES, sessionId, MinesSession.class)
                .orElseThrow(GameException::sessionNotFound);
    }
}
