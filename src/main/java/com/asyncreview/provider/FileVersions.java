package com.asyncreview.provider;

import com.asyncreview.core.model.FileContents;

/**
 * Base and head versions of one file. Either side is {@code null} when the file does
 * not exist at that revision.
 */
public record FileVersions(
    FileContents oldFile,
    FileContents newFile
) {
    public static final FileVersions NONE = new FileVersions(null, null);
}
