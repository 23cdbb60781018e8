package com.asyncreview.provider;

import com.asyncreview.core.model.ChangeSet;

/**
 * A Git hosting service that serves pull/merge requests.
 * Implementations: GitLabProvider, GitHubProvider.
 */
public interface ChangeRequestProvider {

    /** Provider identifier stored on loaded change sets, e.g. "github". */
    String name();

    /** Returns {@code true} if the URL looks like a change request of this provider. */
    boolean canHandle(String url);

    /**
     * Loads metadata, changed files, commits and comments.
     * Commits and comments are best effort and come back empty when their calls fail.
     *
     * @throws com.asyncreview.core.InvalidInputException if the URL cannot be parsed
     * @throws TransientProviderException                 if metadata or the file list cannot be fetched
     */
    ChangeSet load(String url, String sessionId);

    /**
     * Fetches base and head text of a file. A side missing at its revision is {@code null}.
     *
     * @throws TransientProviderException on failures other than not-found
     */
    FileVersions fetchContent(ChangeSet changeSet, String path);
}
