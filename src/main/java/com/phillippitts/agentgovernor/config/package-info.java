/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.agentgovernor.config.GovernanceConfig} - wiring of the
 *       evaluator, remediation manager, lifecycle controller and collaborator defaults</li>
 *   <li>{@link com.phillippitts.agentgovernor.config.ThreadPoolConfig} - executors for
 *       collaborator I/O and the scheduled fleet sweep</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code governance.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - MDC servlet filter</li>
 * </ul>
 */
package com.phillippitts.agentgovernor.config;
