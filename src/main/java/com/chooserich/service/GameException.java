package com.chooserich.service;

/**
 * Typed failure of a game or settlement operation. The HTTP layer maps {@link #getKind()} to a status
 * code; nothing inside the core retries on it.
 */
public class GameException extends RuntimeException {

    private final ErrorKind kind;

    public GameException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GameException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static GameException invalidConfiguration(String message) {
        return new GameException(ErrorKind.INVALID_CONFIGURATION, message);
    }

    public static GameException invalidMove(String message) {
        return new GameException(ErrorKind.INVALID_MOVE, message);
    }

    public static GameException sessionNotFound() {
        return new GameException(ErrorKind.INVALID_MOVE, "Session not found");
    }

    public static GameException unauthorized() {
        return new GameException(ErrorKind.UNAUTHORIZED, "Session belongs to another player");
    }

    public static GameException notActive() {
        return new GameException(ErrorKind.NOT_ACTIVE, "Session is not active");
    }

    public static GameException conflict(String message) {
        return new GameException(ErrorKind.CONFLICT, message);
    }

    public static GameException insufficientFunds() {
        return new GameException(ErrorKind.INSUFFICIENT_FUNDS, "Insufficient balance");
    }

    public static GameException internal(String message, Throwable cause) {
        return new GameException(ErrorKind.INTERNAL_ERROR, message, cause);
    }
}
