package com.chooserich.service;

import com.chooserich.dto.ApexOdds;
import com.chooserich.dto.ApexResult;
import com.chooserich.dto.ComparisonOdds;
import com.chooserich.model.ApexMode;
import com.chooserich.model.ApexSession;
import com.chooserich.model.Comparison;
import com.chooserich.model.SessionStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Single-draw number game. A system number in 0..9 is drawn at start; the player wins by predicting
 * how a second independent draw compares to it.
 */
@ApplicationScoped
public class ApexEngine {

    static final int MIN_NUMBER = 0;
    static final int MAX_NUMBER = 9;
    static final double BLIND_WIN_PROBABILITY = 0.45;

    private final RandomSource randomSource;
    private final double houseEdge;

    @Inject
    public ApexEngine(@AuditedRandom RandomSource randomSource,
            @ConfigProperty(name = "game.house-edge", defaultValue = "0.01") double houseEdge) {
        this.randomSource = randomSource;
        this.houseEdge = houseEdge;
    }

    public ApexSession create(BigDecimal stake, ApexMode mode, String owner) {
        if (mode == null) {
            throw GameException.invalidConfiguration("Mode is required");
        }
        int systemNumber = draw();
        // blind rounds draw both numbers before the player can react
        Integer userNumber = mode == ApexMode.BLIND ? draw() : null;
        return new ApexSession(UUID.randomUUID().toString(), owner, stake, mode, systemNumber, userNumber);
    }

    public ApexResult resolveBlind(ApexSession session, String requester) {
        checkPlayable(session, requester);
        if (session.getMode() != ApexMode.BLIND) {
            throw GameException.invalidMove("Not a blind round");
        }

        int userNumber = session.getUserNumber();
        // a draw goes to the house
        boolean won = userNumber > session.getSystemNumber();
        BigDecimal payout = won ? Payouts.apply(session.getStake(), blindOdds().multiplier()) : Payouts.zero();

        finish(session, null, userNumber, won, payout);
        return new ApexResult(session.getId(), null, userNumber, session.getSystemNumber(), won, payout,
                SessionStatus.ENDED);
    }

    public ApexResult resolveChoice(ApexSession session, Comparison comparison, String requester) {
        checkPlayable(session, requester);
        if (session.getMode() != ApexMode.CHOICE) {
            throw GameException.invalidMove("Cannot choose in a blind round");
        }
        if (comparison == null) {
            throw GameException.invalidMove("Comparison is required");
        }
        ComparisonOdds odds = oddsFor(comparison, session.getSystemNumber());
        if (!odds.isPlayable()) {
            throw GameException.invalidMove(comparison + " cannot win against " + session.getSystemNumber());
        }

        int drawn = draw();
        boolean won = comparison.matches(drawn, session.getSystemNumber());
        BigDecimal payout = won ? Payouts.apply(session.getStake(), odds.multiplier()) : Payouts.zero();

        finish(session, comparison, drawn, won, payout);
        return new ApexResult(session.getId(), comparison, drawn, session.getSystemNumber(), won, payout,
                SessionStatus.ENDED);
    }

    /** Display-only; leaves the session untouched. */
    public ApexOdds odds(ApexSession session) {
        if (session.getMode() == ApexMode.BLIND) {
            return new ApexOdds(null, blindOdds());
        }
        Map<Comparison, ComparisonOdds> comparisons = new EnumMap<>(Comparison.class);
        for (Comparison comparison : Comparison.values()) {
            comparisons.put(comparison, oddsFor(comparison, session.getSystemNumber()));
        }
        return new ApexOdds(comparisons, null);
    }

    public ComparisonOdds oddsFor(Comparison comparison, int systemNumber) {
        double probability;
        switch (comparison) {
            case GREATER:
                probability = (MAX_NUMBER - systemNumber) / 10.0;
                break;
            case LESS:
                probability = systemNumber / 10.0;
                break;
            default:
                probability = 1.0 / 10.0;
                break;
        }
        return odds(probability);
    }

    public ComparisonOdds blindOdds() {
        return odds(BLIND_WIN_PROBABILITY);
    }

    private ComparisonOdds odds(double probability) {
        return new ComparisonOdds(Payouts.quantize(probability), Payouts.quantize(multiplierFor(probability)));
    }

    double multiplierFor(double probability) {
        if (probability <= 0.0) {
            return 0.0;
        }
        return (1.0 - houseEdge) / probability;
    }

    private int draw() {
        return randomSource.nextInt(MIN_NUMBER, MAX_NUMBER);
    }

    private void checkPlayable(ApexSession session, String requester) {
        if (!session.getOwner().equals(requester)) {
            throw GameException.unauthorized();
        }
        if (!session.isActive()) {
            throw GameException.notActive();
        }
    }

    private static void finish(ApexSession session, Comparison comparison, int drawn, boolean won,
            BigDecimal payout) {
        session.setStatus(SessionStatus.ENDED);
        session.setComparison(comparison);
        session.setDrawnNumber(drawn);
        session.setWon(won);
        session.setPayout(payout);
    }
}
