package com.phillippitts.agentgovernor.service.penalty.event;

import com.phillippitts.agentgovernor.domain.Appeal;

/**
 * Published when an appeal enters review.
 *
 * @param automatic true when filed by anomaly detection rather than the agent
 */
public record AppealFiledEvent(Appeal appeal, boolean automatic) { }
