/**
 * Statistical evaluation of agent telemetry.
 *
 * <p>{@link com.phillippitts.agentgovernor.service.evaluation.PerformanceEvaluator} derives
 * triggers and penalty levels and checks penalties for anomalies;
 * {@link com.phillippitts.agentgovernor.service.evaluation.MetricsHistory} keeps each agent's
 * recent readings for the normal-variance check.
 */
package com.phillippitts.agentgovernor.service.evaluation;
