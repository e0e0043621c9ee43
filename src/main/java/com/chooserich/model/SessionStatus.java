package com.chooserich.model;

public enum SessionStatus {
    ACTIVE,
    ENDED
}
