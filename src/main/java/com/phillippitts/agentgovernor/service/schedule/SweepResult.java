package com.phillippitts.agentgovernor.service.schedule;

/**
 * Outcome counts of one fleet sweep.
 *
 * @param evaluated agents whose metrics were evaluated
 * @param penalized evaluations that applied a penalty
 * @param recovered penalties lifted by a recovery check
 * @param failed    agents whose evaluation threw
 * @param expired   penalties removed because their duration elapsed
 */
public record SweepResult(int evaluated, int penalized, int recovered, int failed, int expired) { }
