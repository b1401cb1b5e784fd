package com.phillippitts.agentgovernor.service.remediation.event;

import java.time.Instant;

/** Published when an agent passes the final stage with a sufficient aggregate score. */
public record RemediationGraduatedEvent(String agentId, String sessionId, double score, Instant at) { }
