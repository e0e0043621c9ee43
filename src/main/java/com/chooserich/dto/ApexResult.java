package com.chooserich.dto;

import com.chooserich.model.Comparison;
import com.chooserich.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApexResult(
        String sessionId,
        Comparison comparison,
        int drawnNumber,
        int systemNumber,
        boolean won,
        BigDecimal payout,
        SessionStatus status) {
}
