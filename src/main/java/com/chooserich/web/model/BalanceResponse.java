package com.chooserich.web.model;

import java.math.BigDecimal;

public record BalanceResponse(String owner, BigDecimal balance) {
}
