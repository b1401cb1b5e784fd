package com.phillippitts.agentgovernor.domain;

import java.util.List;

/**
 * Sanctions attached to a penalty level.
 *
 * @param computeMultiplier    share of normal compute the agent keeps
 * @param taskPriority         priority offset applied by task schedulers
 * @param allowedTaskTypes     permitted task types, or {@code null} for unrestricted
 * @param canLeadCollaboration whether the agent may lead collaborations
 * @param requiresSupervision  whether work must be supervised
 */
public record Restrictions(
        double computeMultiplier,
        int taskPriority,
        List<String> allowedTaskTypes,
        boolean canLeadCollaboration,
        boolean requiresSupervision
) {

    public static final Restrictions NONE = new Restrictions(1.0, 0, null, true, false);

    public Restrictions {
        if (allowedTaskTypes != null) {
            allowedTaskTypes = List.copyOf(allowedTaskTypes);
        }
    }
}
