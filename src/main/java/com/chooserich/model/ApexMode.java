package com.chooserich.model;

public enum ApexMode {
    /** Both numbers are drawn at start and the round resolves immediately. */
    BLIND,
    /** The player picks a comparison; the second number is drawn when they choose. */
    CHOICE
}
