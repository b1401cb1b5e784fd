package com.phillippitts.agentgovernor.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppealRecordsTest {

    @Test
    void shouldDropNullEvidenceEntries() {
        Map<String, Object> evidence = new HashMap<>();
        evidence.put("incident", "INC-42");
        evidence.put("ticket", null);
        evidence.put(null, "orphan");

        AppealGrounds grounds = new AppealGrounds("environmental_factors", "Outage", evidence);

        assertThat(grounds.evidence()).containsExactly(Map.entry("incident", "INC-42"));
    }

    @Test
    void shouldDefaultMissingExplanationAndEvidence() {
        AppealGrounds grounds = new AppealGrounds("systemic_issue", null, null);

        assertThat(grounds.explanation()).isEmpty();
        assertThat(grounds.evidence()).isEmpty();
    }

    @Test
    void shouldRejectNullGroundsType() {
        assertThatThrownBy(() -> new AppealGrounds(null, "x", Map.of()))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Grounds type must not be null");
    }

    @Test
    void shouldDropNullReviewComments() {
        AppealReview review = new AppealReview("reviewer-1", AppealDecision.DENIED,
                Arrays.asList("metrics accurate", null, "no outage"), Instant.EPOCH);

        assertThat(review.comments()).containsExactly("metrics accurate", "no outage");
    }

    @Test
    void shouldRejectNullReviewer() {
        assertThatThrownBy(() -> new AppealReview(null, AppealDecision.APPROVED, null, Instant.EPOCH))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("reviewerId must not be null");
    }
}
