package com.chooserich.model;

public enum TransactionKind {
    STAKE,
    BET_LOSS,
    BET_WIN,
    CASHOUT,
    REFUND,
    DEPOSIT,
    WITHDRAWAL
}
