package com.chooserich.service;

public enum ErrorKind {
    INVALID_CONFIGURATION,
    INVALID_MOVE,
    UNAUTHORIZED,
    NOT_ACTIVE,
    CONFLICT,
    INSUFFICIENT_FUNDS,
    INTERNAL_ERROR
}
