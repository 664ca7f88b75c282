package com.williamcallahan.lawlens.service.navigation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.williamcallahan.lawlens.config.AppProperties;
import com.williamcallahan.lawlens.service.retrieval.SectionExpansionService;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registry of citation viewer sessions.
 *
 * <p>A navigator is created on the first request for a session id and discarded when the
 * viewer closes for good or the session sits idle past {@code app.viewer.session-ttl}.
 * Discarding cancels any expansion still in flight.</p>
 */
@Service
public class CitationViewerSessions {
    private static final Logger logger = LoggerFactory.getLogger(CitationViewerSessions.class);

    private final SectionExpansionService expansionService;
    private final Cache<String, CitationNavigator> sessions;

    public CitationViewerSessions(SectionExpansionService expansionService, AppProperties appProperties) {
        this.expansionService = expansionService;
        AppProperties.Viewer viewer = appProperties.getViewer();
        this.sessions = Caffeine.newBuilder()
                .maximumSize(viewer.getMaxSessions())
                .expireAfterAccess(viewer.getSessionTtl())
                .executor(Runnable::run)
                .removalListener((String sessionId, CitationNavigator navigator, RemovalCause cause) -> {
                    if (navigator != null) {
                        navigator.discard();
                    }
                    logger.info("Viewer session {} removed ({})", sessionId, cause);
                })
                .build();
    }

    /**
     * Returns the navigator for a session, creating it on first use.
     *
     * @param sessionId viewer session id
     * @return navigator
     */
    public CitationNavigator getOrCreate(String sessionId) {
        return sessions.get(sessionId, id -> {
            logger.info("Viewer session {} created", id);
            return new CitationNavigator(id, expansionService);
        });
    }

    public Optional<CitationNavigator> find(String sessionId) {
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    /**
     * Discards a session and cancels its pending fetches.
     *
     * @param sessionId viewer session id
     * @return true when the session existed
     */
    public boolean discard(String sessionId) {
        return sessions.asMap().remove(sessionId) != null;
    }

    public long activeSessionCount() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
