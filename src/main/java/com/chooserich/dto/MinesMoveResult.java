package com.chooserich.dto;

import com.chooserich.model.MoveAction;
import com.chooserich.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MinesMoveResult(
        String sessionId,
        List<MoveAction> actions,
        Double currentMultiplier,
        BigDecimal potentialPayout,
        BigDecimal finalPayout,
        List<Integer> mineBlocks,
        SessionStatus status) {

    @JsonIgnore
    public boolean isBust() {
        return status == SessionStatus.ENDED;
    }
}
