package com.asyncreview.dispatch.api;

/**
 * Inbound JSON body for POST /api/reviews.
 *
 * @param url pull request or merge request URL
 */
public record LoadReviewRequest(String url) {}
