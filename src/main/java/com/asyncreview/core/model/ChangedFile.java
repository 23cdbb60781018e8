package com.asyncreview.core.model;

/**
 * A file entry in a loaded change set, as reported by the hosting provider.
 */
public record ChangedFile(
    String path,
    FileStatus status,
    int additions,
    int deletions,
    String patch
) {}
