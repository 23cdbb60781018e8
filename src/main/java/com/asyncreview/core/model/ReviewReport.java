package com.asyncreview.core.model;

import java.util.List;

public record ReviewReport(
    List<ReviewIssue> issues,
    String summary
) {}
