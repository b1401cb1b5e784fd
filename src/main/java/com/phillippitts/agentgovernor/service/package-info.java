/**
 * Governance services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.evaluation} - triggers, penalty levels, anomaly and fairness checks</li>
 *   <li>{@code service.throttle} - per-agent token bucket</li>
 *   <li>{@code service.remediation} - four-stage retraining curriculum</li>
 *   <li>{@code service.penalty} - penalty lifecycle, appeals, probation</li>
 *   <li>{@code service.collaborator} - metrics source, event bus and system health adapters</li>
 *   <li>{@code service.schedule} - periodic fleet sweep</li>
 *   <li>{@code service.metrics} - Micrometer counters</li>
 * </ul>
 */
package com.phillippitts.agentgovernor.service;
