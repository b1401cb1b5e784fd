package com.phillippitts.agentgovernor.service.remediation.event;

import java.time.Instant;
import java.util.List;

/** Published when an agent enters the retraining curriculum. */
public record RemediationStartedEvent(String agentId, String sessionId, List<String> deficiencies, Instant at) { }
