package com.chooserich.web.model;

import com.chooserich.model.ApexMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record ApexStartRequest(
        @NotNull @DecimalMin(value = "0.01") BigDecimal stake,
        @NotNull ApexMode mode) {
}
