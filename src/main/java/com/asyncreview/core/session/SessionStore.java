package com.asyncreview.core.session;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.model.ChangeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory store of loaded review sessions, keyed by session id.
 *
 * <p>Holds at most {@code asyncreview.session.max-sessions} entries; storing one more
 * evicts the oldest. Nothing survives a restart.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final int maxSessions;
    private final Map<String, ReviewSession> sessions = new LinkedHashMap<>();

    public SessionStore(AsyncReviewProperties properties) {
        this.maxSessions = Math.max(1, properties.getSession().getMaxSessions());
    }

    public synchronized ReviewSession put(ChangeSet changeSet) {
        var session = new ReviewSession(changeSet);
        sessions.put(changeSet.sessionId(), session);
        Iterator<String> oldest = sessions.keySet().iterator();
        while (sessions.size() > maxSessions && oldest.hasNext()) {
            String evicted = oldest.next();
            oldest.remove();
            log.info("SessionStore at capacity ({}), evicted session {}", maxSessions, evicted);
        }
        log.debug("Stored session {} ({} files)", changeSet.sessionId(), changeSet.changedFiles());
        return session;
    }

    public synchronized Optional<ReviewSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException if the id is unknown or evicted
     */
    public ReviewSession require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public synchronized boolean remove(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    public synchronized int size() {
        return sessions.size();
    }
}
