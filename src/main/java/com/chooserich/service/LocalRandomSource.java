package com.chooserich.service;

import java.security.SecureRandom;

public class LocalRandomSource implements RandomSource {

    private final SecureRandom random;

    public LocalRandomSource() {
        this(new SecureRandom());
    }

    LocalRandomSource(SecureRandom random) {
        this.random = random;
    }

    @Override
    public int nextInt(int minInclusive, int maxInclusive) {
        if (maxInclusive < minInclusive) {
            throw new IllegalArgumentException("Empty range [" + minInclusive + ", " + maxInclusive + "]");
        }
        return minInclusive + random.nextInt(maxInclusive - minInclusive + 1);
    }
}
