package com.chooserich.service;

import com.chooserich.model.GameKind;
import com.chooserich.repository.SessionStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Caffeine only evicts expired sessions while the cache is touched; this drains them on a schedule so
 * abandoned rounds do not pile up during quiet periods.
 */
@ApplicationScoped
public class SessionSweeper {

    private static final Logger LOG = Logger.getLogger(SessionSweeper.class);

    private final SessionStore sessionStore;

    @Inject
    public SessionSweeper(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(every = "{game.session.sweep-interval}")
    void sweep() {
        sessionStore.cleanUp();
        for (GameKind kind : GameKind.values()) {
            LOG.debug("Live " + kind.label() + " sessions: " + sessionStore.estimatedSize(kind));
        }
    }
}
