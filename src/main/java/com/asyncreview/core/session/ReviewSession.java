package com.asyncreview.core.session;

import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.provider.FileVersions;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * A loaded change set plus the file versions fetched for it so far.
 */
public class ReviewSession {

    private final ChangeSet changeSet;
    private final Map<String, FileVersions> contents = new ConcurrentHashMap<>();

    public ReviewSession(ChangeSet changeSet) {
        this.changeSet = changeSet;
    }

    public String id() {
        return changeSet.sessionId();
    }

    public ChangeSet changeSet() {
        return changeSet;
    }

    /**
     * Cached versions of {@code path}, fetched with {@code loader} on first use.
     * The loader runs outside the map; when two callers race, the first stored value wins.
     */
    public FileVersions contents(String path, Function<String, FileVersions> loader) {
        FileVersions cached = contents.get(path);
        if (cached != null) {
            return cached;
        }
        FileVersions loaded = loader.apply(path);
        if (loaded == null) {
            return null;
        }
        FileVersions existing = contents.putIfAbsent(path, loaded);
        return existing != null ? existing : loaded;
    }

    public int cachedFiles() {
        return contents.size();
    }
}
