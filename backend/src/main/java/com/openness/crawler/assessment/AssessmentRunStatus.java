package com.openness.crawler.assessment;

public enum AssessmentRunStatus {
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    NO_TARGETS,
    CANCELLED
}
