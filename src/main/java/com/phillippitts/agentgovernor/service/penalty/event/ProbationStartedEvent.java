package com.phillippitts.agentgovernor.service.penalty.event;

import com.phillippitts.agentgovernor.domain.ProbationPeriod;

/** Published when a graduated agent enters probation. */
public record ProbationStartedEvent(ProbationPeriod probation) { }
