package com.chooserich.web.model;

import com.chooserich.model.MinesSession;
import com.chooserich.model.SessionStatus;

import java.math.BigDecimal;

public record MinesStartResponse(String sessionId, BigDecimal stake, int blocks, int mines, SessionStatus status) {

    public static MinesStartResponse from(MinesSession session) {
        return new MinesStartResponse(session.getId(), session.getStake(), session.getBlocks(), session.getMines(),
                session.getStatus());
    }
}
