package com.asyncreview.core.session;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.logging.MdcContext;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.provider.ChangeRequestProvider;
import com.asyncreview.provider.FileVersions;
import com.asyncreview.provider.ProviderRegistry;
import com.asyncreview.provider.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Loads pull/merge requests into the {@link SessionStore} and serves their file contents.
 */
@Service
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final ProviderRegistry registry;
    private final SessionStore store;
    private final ReviewMetrics metrics;

    public ReviewSessionService(ProviderRegistry registry, SessionStore store, ReviewMetrics metrics) {
        this.registry = registry;
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Resolves the provider for {@code url}, loads the change request and stores it
     * under a fresh session id.
     *
     * @throws InvalidInputException      if no provider handles the URL or it is malformed
     * @throws TransientProviderException if the provider's required calls fail
     */
    public ChangeSet load(String url) {
        ChangeRequestProvider provider = registry.forUrl(url == null ? null : url.strip());
        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setSession(sessionId);
        try {
            ChangeSet changeSet = provider.load(url.strip(), sessionId);
            store.put(changeSet);
            metrics.recordProviderLoad(provider.name(), true);
            log.info("Session {} loaded from {} ({} files)", sessionId, provider.name(), changeSet.changedFiles());
            return changeSet;
        } catch (TransientProviderException e) {
            metrics.recordProviderLoad(provider.name(), false);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<ChangeSet> getCached(String sessionId) {
        return store.get(sessionId).map(ReviewSession::changeSet);
    }

    /**
     * @throws SessionNotFoundException if the id is unknown or evicted
     */
    public ChangeSet require(String sessionId) {
        return store.require(sessionId).changeSet();
    }

    /**
     * Base and head versions of a file in a loaded session, fetched once and cached.
     *
     * @throws SessionNotFoundException   if the id is unknown or evicted
     * @throws TransientProviderException if the provider fails for a reason other than not-found
     */
    public FileVersions fetchContent(String sessionId, String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidInputException("A file path is required");
        }
        ReviewSession session = store.require(sessionId);
        ChangeSet changeSet = session.changeSet();
        ChangeRequestProvider provider = registry.byName(changeSet.provider());
        return session.contents(path, p -> provider.fetchContent(changeSet, p));
    }
}
