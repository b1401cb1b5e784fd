package com.phillippitts.agentgovernor.service.penalty.event;

import java.time.Instant;

/** Published when an approved appeal overturns a penalty. */
public record PenaltyReversedEvent(String agentId, String penaltyId, String appealId, String reviewerId, Instant at) { }
