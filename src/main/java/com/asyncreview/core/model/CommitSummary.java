package com.asyncreview.core.model;

public record CommitSummary(
    String sha,
    String message,
    String authorName,
    String authorLogin,
    String date,
    String url
) {}
