package com.chooserich.web.model;

import com.chooserich.model.MinesSession;
import com.chooserich.model.MoveAction;
import com.chooserich.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a Mines round. Mine positions stay hidden until the round has ended.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MinesSessionView(
        String sessionId,
        BigDecimal stake,
        int blocks,
        int mines,
        double currentMultiplier,
        List<MoveAction> actions,
        List<Integer> mineBlocks,
        SessionStatus status) {

    public static MinesSessionView from(MinesSession session) {
        List<Integer> mineBlocks = session.isActive() ? null : new ArrayList<>(session.getMinePositions());
        return new MinesSessionView(session.getId(), session.getStake(), session.getBlocks(), session.getMines(),
                session.getCurrentMultiplier(), new ArrayList<>(session.getActions()), mineBlocks,
                session.getStatus());
    }
}
