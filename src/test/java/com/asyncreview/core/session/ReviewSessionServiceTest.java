package com.asyncreview.core.session;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.FileContents;
import com.asyncreview.provider.ChangeRequestProvider;
import com.asyncreview.provider.FileVersions;
import com.asyncreview.provider.ProviderRegistry;
import com.asyncreview.provider.TransientProviderException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ReviewSessionService}.
 */
class ReviewSessionServiceTest {

    private static final String URL = "https://github.com/o/r/pull/1";

    private ProviderRegistry registry;
    private ChangeRequestProvider provider;
    private SessionStore store;
    private SimpleMeterRegistry meters;
    private ReviewSessionService service;

    @BeforeEach
    void setUp() {
        registry = mock(ProviderRegistry.class);
        provider = mock(ChangeRequestProvider.class);
        when(provider.name()).thenReturn("github");
        when(registry.forUrl(URL)).thenReturn(provider);
        when(registry.byName("github")).thenReturn(provider);
        when(provider.load(eq(URL), anyString()))
                .thenAnswer(inv -> SessionStoreTest.changeSet(inv.getArgument(1)));
        store = new SessionStore(new AsyncReviewProperties());
        meters = new SimpleMeterRegistry();
        service = new ReviewSessionService(registry, store, new ReviewMetrics(meters));
    }

    @Test
    @DisplayName("load stores the change set under a fresh 8-character id")
    void load() {
        ChangeSet cs = service.load("  " + URL + " ");

        assertEquals(8, cs.sessionId().length());
        assertSame(cs, service.require(cs.sessionId()));
        assertTrue(service.getCached(cs.sessionId()).isPresent());
        assertEquals(1.0, meters.get("asyncreview.provider.loads").tag("success", "true").counter().count());
    }

    @Test
    @DisplayName("two loads of the same URL create two sessions")
    void distinctSessions() {
        assertNotEquals(service.load(URL).sessionId(), service.load(URL).sessionId());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("provider failures are counted and propagate")
    void loadFailure() {
        when(provider.load(eq(URL), anyString())).thenThrow(new TransientProviderException("HTTP 502", 502));

        assertThrows(TransientProviderException.class, () -> service.load(URL));
        assertEquals(0, store.size());
        assertEquals(1.0, meters.get("asyncreview.provider.loads").tag("success", "false").counter().count());
    }

    @Test
    @DisplayName("file contents are fetched from the session's provider once")
    void fetchContentCached() {
        ChangeSet cs = service.load(URL);
        var versions = new FileVersions(null, new FileContents("a.py", "x", "o/r/h/a.py"));
        when(provider.fetchContent(any(ChangeSet.class), eq("a.py"))).thenReturn(versions);

        assertSame(versions, service.fetchContent(cs.sessionId(), "a.py"));
        assertSame(versions, service.fetchContent(cs.sessionId(), "a.py"));
        verify(provider, times(1)).fetchContent(any(ChangeSet.class), eq("a.py"));
    }

    @Test
    @DisplayName("fetchContent validates the path and the session")
    void fetchContentValidation() {
        assertThrows(InvalidInputException.class, () -> service.fetchContent("whatever", " "));
        assertThrows(SessionNotFoundException.class, () -> service.fetchContent("missing", "a.py"));
    }

    @Test
    @DisplayName("getCached is empty for unknown ids")
    void getCachedUnknown() {
        assertTrue(service.getCached("missing").isEmpty());
    }
}
