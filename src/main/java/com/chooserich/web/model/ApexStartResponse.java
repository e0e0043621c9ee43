package com.chooserich.web.model;

import com.chooserich.dto.ApexOdds;
import com.chooserich.dto.ApexResult;
import com.chooserich.model.ApexMode;
import com.chooserich.model.ApexSession;
import com.chooserich.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApexStartResponse(
        String sessionId,
        BigDecimal stake,
        ApexMode mode,
        int systemNumber,
        Integer userNumber,
        ApexOdds odds,
        ApexResult blindResult,
        SessionStatus status) {

    public static ApexStartResponse from(ApexSession session, ApexOdds odds, ApexResult blindResult) {
        return new ApexStartResponse(session.getId(), session.getStake(), session.getMode(),
                session.getSystemNumber(), session.getUserNumber(), odds, blindResult, session.getStatus());
    }
}
