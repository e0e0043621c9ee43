package com.chooserich.dto;

import com.chooserich.model.MoveAction;
import com.chooserich.model.SessionStatus;

import java.math.BigDecimal;
import java.util.List;

public record MinesCashoutResult(
        String sessionId,
        BigDecimal stake,
        double multiplier,
        BigDecimal finalPayout,
        List<MoveAction> actions,
        List<Integer> mineBlocks,
        SessionStatus status) {
}
