package com.chooserich.service;

import com.chooserich.dto.ApexResult;
import com.chooserich.model.ApexMode;
import com.chooserich.model.ApexSession;
import com.chooserich.model.Comparison;
import com.chooserich.model.GameKind;
import com.chooserich.repository.SessionStore;
import com.chooserich.repository.Versioned;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigDecimal;

@ApplicationScoped
public class ApexGameService {

    private static final Logger LOG = Logger.getLogger(ApexGameService.class);

    private final ApexEngine engine;
    private final SessionStore sessionStore;
    private final SettlementCoordinator settlement;

    @Inject
    public ApexGameService(ApexEngine engine, SessionStore sessionStore, SettlementCoordinator settlement) {
        this.engine = engine;
        this.sessionStore = sessionStore;
        this.settlement = settlement;
    }

    /**
     * Opens a round. Blind rounds are resolved and settled before this returns; the returned result is
     * {@code null} for choice rounds.
     */
    public Started start(String owner, BigDecimal stake, ApexMode mode) {
        BigDecimal normalized = settlement.normalizeStake(stake);
        ApexSession session = engine.create(normalized, mode, owner);

        long version = settlement.open(session,
                mode == ApexMode.BLIND ? "Apex blind game bet" : "Apex choice game bet");

        if (mode != ApexMode.BLIND) {
            return new Started(session, null);
        }

        ApexResult result = engine.resolveBlind(session, owner);
        sessionStore.put(GameKind.APEX, session.getId(), version, session);
        LOG.info("Apex blind " + session.getId() + ": " + result.drawnNumber() + " vs " + result.systemNumber());
        settlement.settle(session, result.payout(), "Apex blind round");
        return new Started(session, result);
    }

    public ApexResult choose(String owner, String sessionId, Comparison comparison) {
        Versioned<ApexSession> current = load(sessionId);
        ApexSession session = current.value();

        ApexResult result = engine.resolveChoice(session, comparison, owner);

        sessionStore.put(GameKind.APEX, sessionId, current.version(), session);
        LOG.info("Apex choice " + sessionId + ": " + comparison + ", drew " + result.drawnNumber() + " vs "
                + result.systemNumber());
        settlement.settle(session, result.payout(), "Apex choice round (" + comparison + ")");
        return result;
    }

    public ApexSession find(String owner, String sessionId) {
        ApexSession session = load(sessionId).value();
        if (!session.getOwner().equals(owner)) {
            throw GameException.unauthorized();
        }
        return session;
    }

    private Versioned<ApexSession> load(String sessionId) {
        return sessionStore.get(GameKind.APEX, sessionId, ApexSession.class)
                .orElseThrow(GameException::sessionNotFound);
    }

    public record Started(ApexSession session, ApexResult blindResult) {
    }
}
