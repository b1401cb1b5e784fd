package com.phillippitts.agentgovernor.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Reviewer verdict on an appeal. Null comments are dropped.
 */
public record AppealReview(String reviewerId, AppealDecision decision, List<String> comments, Instant reviewedAt) {

    public AppealReview {
        Objects.requireNonNull(reviewerId, "reviewerId must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
        Objects.requireNonNull(reviewedAt, "reviewedAt must not be null");
        comments = comments == null ? List.of() : comments.stream().filter(Objects::nonNull).toList();
    }
}
