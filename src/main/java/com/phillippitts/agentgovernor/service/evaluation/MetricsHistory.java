package com.phillippitts.agentgovernor.service.evaluation;

import com.phillippitts.agentgovernor.domain.AgentMetrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-agent window of earlier metric readings.
 *
 * <p>Each agent's window is guarded by its own monitor, so recording for one agent never
 * blocks another.
 */
public class MetricsHistory {

    private final int window;
    private final Map<String, Deque<Reading>> readings = new ConcurrentHashMap<>();

    public MetricsHistory(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        this.window = window;
    }

    /** Appends a reading, evicting the oldest once the window is full. */
    public void record(AgentMetrics metrics) {
        Deque<Reading> deque = readings.computeIfAbsent(metrics.agentId(), id -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(new Reading(metrics.currentQuality(), metrics.resourceUsage().peak(), metrics.successRate()));
            while (deque.size() > window) {
                deque.removeFirst();
            }
        }
    }

    /** Readings for the agent, oldest first; empty when none were recorded. */
    public List<Reading> readings(String agentId) {
        Deque<Reading> deque = readings.get(agentId);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return List.copyOf(new ArrayList<>(deque));
        }
    }

    public void clear(String agentId) {
        readings.remove(agentId);
    }

    /**
     * One historical observation.
     */
    public record Reading(double quality, double resourcePeak, double successRate) {}
}
