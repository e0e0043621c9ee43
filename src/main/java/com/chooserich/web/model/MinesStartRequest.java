package com.chooserich.web.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record MinesStartRequest(
        @NotNull @DecimalMin(value = "0.01") BigDecimal stake,
        @Min(1) @Max(400) int blocks,
        @Min(1) int mines) {
}
