package com.phillippitts.agentgovernor.service.remediation.event;

import java.time.Instant;

/** Published when a retraining session ends without graduation. */
public record RemediationFailedEvent(String agentId, String sessionId, String reason, Instant at) { }
