package com.chooserich.web.model;

import com.chooserich.model.ApexMode;
import com.chooserich.model.ApexSession;
import com.chooserich.model.Comparison;
import com.chooserich.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApexSessionView(
        String sessionId,
        BigDecimal stake,
        ApexMode mode,
        int systemNumber,
        Integer userNumber,
        Comparison comparison,
        Integer drawnNumber,
        Boolean won,
        BigDecimal payout,
        SessionStatus status) {

    public static ApexSessionView from(ApexSession session) {
        return new ApexSessionView(session.getId(), session.getStake(), session.getMode(), session.getSystemNumber(),
                session.getUserNumber(), session.getComparison(), session.getDrawnNumber(), session.getWon(),
                session.getPayout(), session.getStatus());
    }
}
