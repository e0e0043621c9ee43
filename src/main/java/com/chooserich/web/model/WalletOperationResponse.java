package com.chooserich.web.model;

import com.chooserich.model.LedgerTransaction;

import java.math.BigDecimal;

public record WalletOperationResponse(String transactionId, BigDecimal amount, BigDecimal newBalance) {

    public static WalletOperationResponse from(LedgerTransaction transaction, BigDecimal newBalance) {
        return new WalletOperationResponse(transaction.id(), transaction.amount(), newBalance);
    }
}
