package com.phillippitts.agentgovernor.domain;

/**
 * Share of each resource dimension granted to an agent.
 */
public record ResourceAllocation(double cpu, double memory, double network, double taskRate) {}
