package com.phillippitts.agentgovernor.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A filed contest against a penalty. Terminal once reviewed.
 *
 * @param review {@code null} while the appeal is pending
 */
public record Appeal(
        String id,
        String penaltyId,
        String agentId,
        AppealGrounds grounds,
        AppealStatus status,
        Instant submittedAt,
        AppealReview review
) {

    public Appeal {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(penaltyId, "penaltyId must not be null");
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(grounds, "grounds must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(submittedAt, "submittedAt must not be null");
    }

    public static Appeal pending(String id, String penaltyId, String agentId, AppealGrounds grounds, Instant at) {
        return new Appeal(id, penaltyId, agentId, grounds, AppealStatus.PENDING, at, null);
    }

    public boolean isResolved() {
        return review != null;
    }

    /** Returns a copy carrying the reviewer's verdict. */
    public Appeal resolve(AppealReview verdict) {
        return new Appeal(id, penaltyId, agentId, grounds, verdict.decision().resultingStatus(), submittedAt, verdict);
    }
}
