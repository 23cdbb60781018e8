package com.asyncreview.core.model;

/**
 * One side (base or head) of a changed file.
 *
 * @param name file path within the repository
 * @param text full text at that revision
 * @param hash provider cache key, e.g. {@code owner/repo/sha/path}
 */
public record FileContents(
    String name,
    String text,
    String hash
) {}
