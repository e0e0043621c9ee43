package com.chooserich.web.model;

import jakarta.validation.constraints.NotBlank;

public record MinesMoveRequest(@NotBlank String sessionId, int block) {
}
