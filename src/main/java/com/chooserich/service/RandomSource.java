package com.chooserich.service;

public interface RandomSource {

    /**
     * Draws a uniformly distributed integer.
     *
     * @param minInclusive lowest value that may be returned
     * @param maxInclusive highest value that may be returned
     * @return a value in {@code [minInclusive, maxInclusive]}
     */
    int nextInt(int minInclusive, int maxInclusive);
}
