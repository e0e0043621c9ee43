package com.chooserich.repository;

import com.chooserich.model.GameKind;
import com.chooserich.model.GameSession;
import com.chooserich.service.GameException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory, per game kind, time-bounded session cache.
 *
 * <p>Entries expire {@code ttl} after their last write. Writes are compare-and-swap on a version stamp
 * so two requests racing on the same session cannot both apply a transition: the loser gets a
 * {@code CONFLICT}. Expired entries are forfeited; nothing is notified.
 */
@ApplicationScoped
public class SessionStore {

    /** Expected version for an insert: the id must not be present. */
    public static final long ABSENT = 0L;

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    private final Map<GameKind, Cache<String, StoredSession>> caches = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Ticker ticker;

    @Inject
    public SessionStore(ObjectMapper objectMapper,
            @ConfigProperty(name = "game.session.ttl", defaultValue = "30M") Duration ttl) {
        this(objectMapper, ttl, Ticker.systemTicker());
    }

    SessionStore(ObjectMapper objectMapper, Duration ttl, Ticker ticker) {
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.ticker = ticker;
    }

    public <S extends GameSession> Optional<Versioned<S>> get(GameKind kind, String id, Class<S> type) {
        if (id == null) {
            return Optional.empty();
        }
        StoredSession stored = cacheFor(kind).getIfPresent(id);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(new Versioned<>(decode(kind, stored.payload(), type), stored.version()));
    }

    /**
     * Writes {@code session} if the stored version still equals {@code expectedVersion}.
     *
     * @return the new version
     * @throws GameException {@code CONFLICT} when another write got there first or the entry expired
     */
    public long put(GameKind kind, String id, long expectedVersion, GameSession session) {
        if (session.getKind() != kind) {
            throw GameException.internal("Refusing to store a " + session.getKind() + " session as " + kind, null);
        }
        String payload = encode(kind, session);
        StoredSession written = cacheFor(kind).asMap().compute(id, (key, current) -> {
            long currentVersion = current == null ? ABSENT : current.version();
            if (currentVersion != expectedVersion) {
                throw GameException.conflict("Session " + key + " was modified concurrently");
            }
            return new StoredSession(currentVersion + 1, payload);
        });
        return written.version();
    }

    /**
     * Removes the entry if it is still at {@code expectedVersion}.
     *
     * @throws GameException {@code CONFLICT} otherwise
     */
    public void remove(GameKind kind, String id, long expectedVersion) {
        cacheFor(kind).asMap().compute(id, (key, current) -> {
            long currentVersion = current == null ? ABSENT : current.version();
            if (currentVersion != expectedVersion) {
                throw GameException.conflict("Session " + key + " was modified concurrently");
            }
            return null;
        });
    }

    public void remove(GameKind kind, String id) {
        cacheFor(kind).invalidate(id);
    }

    public long estimatedSize(GameKind kind) {
        Cache<String, StoredSession> cache = caches.get(kind);
        return cache == null ? 0L : cache.estimatedSize();
    }

    public void cleanUp() {
        caches.values().forEach(Cache::cleanUp);
    }

    private Cache<String, StoredSession> cacheFor(GameKind kind) {
        return caches.computeIfAbsent(kind, k -> {
            LOG.info("Creating session cache for " + k.label() + " (ttl " + ttl + ")");
            return Caffeine.newBuilder()
                    .expireAfterWrite(ttl)
                    .ticker(ticker)
                    .build();
        });
    }

    private String encode(GameKind kind, GameSession session) {
        try {
            return objectMapper.writeValueAsString(new SessionEnvelope(SessionEnvelope.CURRENT_SCHEMA, kind, session));
        } catch (JsonProcessingException e) {
            throw GameException.internal("Could not serialize " + kind.label() + " session", e);
        }
    }

    private <S extends GameSession> S decode(GameKind kind, String payload, Class<S> type) {
        SessionEnvelope envelope;
        try {
            envelope = objectMapper.readValue(payload, SessionEnvelope.class);
        } catch (JsonProcessingException e) {
            throw GameException.internal("Could not deserialize " + kind.label() + " session", e);
        }
        if (envelope.schemaVersion() != SessionEnvelope.CURRENT_SCHEMA) {
            throw GameException.internal("Unsupported session schema " + envelope.schemaVersion(), null);
        }
        GameSession session = envelope.session();
        if (envelope.kind() != kind || session == null || session.getKind() != kind || !type.isInstance(session)) {
            throw GameException.internal("Stored payload is not a " + kind.label() + " session", null);
        }
        return type.cast(session);
    }

    record StoredSession(long version, String payload) {
    }
}
