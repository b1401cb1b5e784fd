package com.phillippitts.agentgovernor.service.penalty.event;

import com.phillippitts.agentgovernor.domain.Penalty;

import java.time.Instant;

/** Published after a penalty is stored and its throttle adjusted. */
public record PenaltyAppliedEvent(Penalty penalty, Instant at) { }
