package com.asyncreview.core.model;

/**
 * Everything known about one changed file when assembling diff context.
 *
 * @param path      path in the head revision (base path for removed files)
 * @param oldFile   base version, {@code null} for added files or when not fetched
 * @param newFile   head version, {@code null} for removed files or when not fetched
 * @param patch     unified-diff patch text, {@code null} when the provider gave none
 * @param status    change status
 * @param additions number of added lines
 * @param deletions number of deleted lines
 */
public record DiffFileContext(
    String path,
    FileContents oldFile,
    FileContents newFile,
    String patch,
    FileStatus status,
    int additions,
    int deletions
) {
    public DiffFileContext {
        if (status == null) {
            status = FileStatus.MODIFIED;
        }
    }

    public static DiffFileContext ofPatch(String path, FileStatus status, int additions, int deletions, String patch) {
        return new DiffFileContext(path, null, null, patch, status, additions, deletions);
    }
}
