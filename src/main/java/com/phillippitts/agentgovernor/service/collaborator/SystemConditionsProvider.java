package com.phillippitts.agentgovernor.service.collaborator;

/**
 * Reports the health of the environment agents run in.
 *
 * <p>Used to soften penalties that coincide with infrastructure trouble.
 */
@FunctionalInterface
public interface SystemConditionsProvider {

    SystemSnapshot currentConditions();
}
