package com.phillippitts.agentgovernor.service.penalty.event;

import com.phillippitts.agentgovernor.domain.Appeal;

/** Published once a reviewer has decided an appeal. */
public record AppealReviewedEvent(Appeal appeal) { }
