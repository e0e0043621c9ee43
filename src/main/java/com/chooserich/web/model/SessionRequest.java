package com.chooserich.web.model;

import jakarta.validation.constraints.NotBlank;

public record SessionRequest(@NotBlank String sessionId) {
}
