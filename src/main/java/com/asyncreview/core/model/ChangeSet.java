package com.asyncreview.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Metadata for a loaded pull request or merge request.
 *
 * @param sessionId session key the change set is stored under
 * @param provider  provider name ("github", "gitlab")
 * @param host      host the change set was loaded from
 * @param owner     owner or group path
 * @param repo      repository or project name
 * @param number    pull/merge request number
 */
public record ChangeSet(
    String sessionId,
    String provider,
    String host,
    String owner,
    String repo,
    int number,
    String title,
    String body,
    String baseSha,
    String headSha,
    List<ChangedFile> files,
    String author,
    String state,
    boolean draft,
    String headRef,
    String baseRef,
    List<CommitSummary> commits,
    List<CommentSummary> comments,
    int additions,
    int deletions,
    Instant loadedAt
) {
    public ChangeSet {
        files = List.copyOf(files);
        commits = commits == null ? List.of() : List.copyOf(commits);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public int changedFiles() {
        return files.size();
    }

    /** Prompt text describing the change set. */
    public String describe() {
        String description = body == null || body.isBlank() ? "No description" : body;
        return "PR #" + number + ": " + title + "\n" + description;
    }
}
