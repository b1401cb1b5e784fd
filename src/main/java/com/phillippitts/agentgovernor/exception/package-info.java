/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.agentgovernor.exception.AgentGovernorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.agentgovernor.exception.NotFoundException} - Thrown when a
 *       penalty or appeal does not exist</li>
 *   <li>{@link com.phillippitts.agentgovernor.exception.InvalidTransitionException} - Thrown when
 *       an operation is not valid for the current penalty or appeal state</li>
 *   <li>{@link com.phillippitts.agentgovernor.exception.CollaboratorFailureException} - Thrown when
 *       the metrics source or event bus fails</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and map to HTTP status
 * codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.agentgovernor.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.agentgovernor.exception;
