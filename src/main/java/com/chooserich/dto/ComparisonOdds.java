package com.chooserich.dto;

public record ComparisonOdds(double probability, double multiplier) {

    public boolean isPlayable() {
        return probability > 0.0;
    }
}
