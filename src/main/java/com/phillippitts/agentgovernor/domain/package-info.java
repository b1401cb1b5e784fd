/**
 * Immutable domain model of the governance engine: telemetry snapshots, triggers,
 * penalties, appeals and the read models built over them.
 *
 * <p>Records validate their invariants in compact constructors. Mutation happens by
 * copying (e.g. {@link com.phillippitts.agentgovernor.domain.Penalty#withAppealStatus}).
 */
package com.phillippitts.agentgovernor.domain;
