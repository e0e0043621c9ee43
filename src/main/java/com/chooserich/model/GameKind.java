package com.chooserich.model;

public enum GameKind {
    MINES("mines"),
    APEX("apex");

    private final String label;

    GameKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
