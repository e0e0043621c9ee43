package com.chooserich.model;

public enum Comparison {
    GREATER,
    LESS,
    EQUAL;

    public boolean matches(int drawn, int systemNumber) {
        switch (this) {
            case GREATER:
                return drawn > systemNumber;
            case LESS:
                return drawn < systemNumber;
            default:
                return drawn == systemNumber;
        }
    }
}
