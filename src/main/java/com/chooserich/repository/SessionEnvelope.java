package com.chooserich.repository;

import com.chooserich.model.GameKind;
import com.chooserich.model.GameSession;

/**
 * Serialized form of a stored session. {@code kind} is written next to the payload so a Mines payload
 * can never be decoded as an Apex round and the other way around.
 */
public record SessionEnvelope(int schemaVersion, GameKind kind, GameSession session) {

    public static final int CURRENT_SCHEMA = 1;
}
