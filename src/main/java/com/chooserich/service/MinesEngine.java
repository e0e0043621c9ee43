package com.chooserich.service;

import com.chooserich.dto.MinesCashoutResult;
import com.chooserich.dto.MinesMoveResult;
import com.chooserich.model.MinesSession;
import com.chooserich.model.MoveAction;
import com.chooserich.model.SessionStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Grid-reveal game. The board holds {@code blocks} cells numbered from 1, {@code mines} of which are
 * hidden mines; every safe reveal grows the multiplier until the player cashes out or hits a mine.
 */
@ApplicationScoped
public class MinesEngine {

    private final RandomSource randomSource;
    private final double houseEdge;

    @Inject
    public MinesEngine(RandomSource randomSource,
            @ConfigProperty(name = "game.house-edge", defaultValue = "0.01") double houseEdge) {
        this.randomSource = randomSource;
        this.houseEdge = houseEdge;
    }

    public void validate(int blocks, int mines) {
        if (blocks < 1) {
            throw GameException.invalidConfiguration("Blocks must be positive");
        }
        int side = (int) Math.sqrt(blocks);
        if (side * side != blocks) {
            throw GameException.invalidConfiguration("Blocks must be a perfect square, got " + blocks);
        }
        if (mines < 1 || mines >= blocks) {
            throw GameException.invalidConfiguration("Mines must be between 1 and " + (blocks - 1));
        }
        // the first factor is the smallest, so every later safe pick grows the multiplier too
        if (multiplierFor(blocks, mines, 1) <= 1.0) {
            throw GameException.invalidConfiguration(
                    "Too few mines for " + blocks + " blocks: a safe pick would not raise the multiplier");
        }
    }

    public MinesSession create(BigDecimal stake, int blocks, int mines, String owner) {
        validate(blocks, mines);

        Set<Integer> minePositions = new HashSet<>();
        while (minePositions.size() < mines) {
            minePositions.add(randomSource.nextInt(1, blocks));
        }
        return new MinesSession(UUID.randomUUID().toString(), owner, stake, blocks, mines, minePositions);
    }

    public MinesMoveResult reveal(MinesSession session, int block, String requester) {
        checkPlayable(session, requester);
        if (block < 1 || block > session.getBlocks()) {
            throw GameException.invalidMove("Block " + block + " is outside 1.." + session.getBlocks());
        }
        if (session.getRevealedBlocks().contains(block)) {
            throw GameException.invalidMove("Block " + block + " is already revealed");
        }

        session.getRevealedBlocks().add(block);

        if (session.getMinePositions().contains(block)) {
            session.setStatus(SessionStatus.ENDED);
            session.getActions().add(new MoveAction(block, 0.0, false));
            return new MinesMoveResult(session.getId(), actionsOf(session), null, null, Payouts.zero(),
                    mineBlocksOf(session), SessionStatus.ENDED);
        }

        int safePicks = session.getRevealedBlocks().size();
        double multiplier = multiplierFor(session.getBlocks(), session.getMines(), safePicks);
        session.setCurrentMultiplier(multiplier);
        session.getActions().add(new MoveAction(block, multiplier, true));

        return new MinesMoveResult(session.getId(), actionsOf(session), multiplier,
                Payouts.apply(session.getStake(), multiplier), null, null, session.getStatus());
    }

    public MinesCashoutResult cashout(MinesSession session, String requester) {
        checkPlayable(session, requester);

        session.setStatus(SessionStatus.ENDED);
        double multiplier = session.getCurrentMultiplier();
        return new MinesCashoutResult(session.getId(), session.getStake(), multiplier,
                Payouts.apply(session.getStake(), multiplier), actionsOf(session), mineBlocksOf(session),
                SessionStatus.ENDED);
    }

    /**
     * Product over picks {@code i = 0..safePicks-1} of {@code (1 - edge) * blocks / (blocks - mines - i)}.
     * The edge compounds per pick.
     */
    public double multiplierFor(int blocks, int mines, int safePicks) {
        double multiplier = 1.0;
        for (int i = 0; i < safePicks; i++) {
            int remaining = blocks - mines - i;
            if (remaining > 0) {
                multiplier *= (1.0 - houseEdge) * blocks / remaining;
            }
        }
        return multiplier;
    }

    private void checkPlayable(MinesSession session, String requester) {
        if (!session.getOwner().equals(requester)) {
            throw GameException.unauthorized();
        }
        if (!session.isActive()) {
            throw GameException.notActive();
        }
    }

    private static List<MoveAction> actionsOf(MinesSession session) {
        return new ArrayList<>(session.getActions());
    }

    private static List<Integer> mineBlocksOf(MinesSession session) {
        return new ArrayList<>(session.getMinePositions());
    }
}
