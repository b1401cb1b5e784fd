package com.phillippitts.agentgovernor.service.penalty.event;

import java.time.Instant;

/**
 * Published when an agent's penalty is lifted.
 *
 * @param reason performance_improved, appeal_approved or expired
 */
public record PenaltyRemovedEvent(String agentId, String penaltyId, String reason, Instant at) { }
