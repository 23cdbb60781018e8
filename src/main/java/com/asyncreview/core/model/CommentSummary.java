package com.asyncreview.core.model;

public record CommentSummary(
    String id,
    String authorLogin,
    String body,
    String createdAt,
    String url
) {}
