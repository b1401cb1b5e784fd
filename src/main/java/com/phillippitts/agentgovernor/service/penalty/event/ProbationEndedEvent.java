package com.phillippitts.agentgovernor.service.penalty.event;

import java.time.Instant;

/** Published when probation ends because the agent's penalty was lifted. */
public record ProbationEndedEvent(String agentId, Instant at) { }
