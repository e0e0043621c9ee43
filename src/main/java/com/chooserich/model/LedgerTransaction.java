package com.chooserich.model;

import java.math.BigDecimal;

/**
 * Immutable audit record written for every balance-affecting event of a game session.
 */
public record LedgerTransaction(
        String id,
        String owner,
        TransactionKind kind,
        BigDecimal amount,
        GameKind gameKind,
        String sessionId,
        String description,
        long createdAt) {
}
