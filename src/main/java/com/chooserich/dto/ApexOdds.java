package com.chooserich.dto;

import com.chooserich.model.Comparison;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Odds shown to the player when a round starts. Choice rounds fill {@code comparisons}, blind rounds
 * fill {@code blind}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApexOdds(Map<Comparison, ComparisonOdds> comparisons, ComparisonOdds blind) {
}
