package com.chooserich.web.model;

import com.chooserich.model.Comparison;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ApexChooseRequest(@NotBlank String sessionId, @NotNull Comparison comparison) {
}
