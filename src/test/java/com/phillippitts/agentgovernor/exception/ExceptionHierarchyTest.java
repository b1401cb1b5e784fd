package com.phillippitts.agentgovernor.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void notFoundShouldIncludeResourceTypeAndId() {
        NotFoundException ex = new NotFoundException("Penalty", "p-1");

        assertThat(ex).isInstanceOf(AgentGovernorException.class);
        assertThat(ex.getMessage()).isEqualTo("Penalty not found: p-1");
        assertThat(ex.getResourceType()).isEqualTo("Penalty");
        assertThat(ex.getResourceId()).isEqualTo("p-1");
    }

    @Test
    void notFoundShouldIncludeDetailWhenGiven() {
        NotFoundException ex = new NotFoundException("Penalty", "p-1", "no active penalty");

        assertThat(ex.getMessage()).contains("p-1").contains("no active penalty");
    }

    @Test
    void invalidTransitionShouldIncludeCurrentState() {
        InvalidTransitionException ex = new InvalidTransitionException("Appeal a-1 was already reviewed", "approved");

        assertThat(ex).isInstanceOf(AgentGovernorException.class);
        assertThat(ex.getMessage()).contains("already reviewed").contains("state: approved");
        assertThat(ex.getCurrentState()).isEqualTo("approved");
    }

    @Test
    void collaboratorFailureShouldIncludeCollaboratorName() {
        CollaboratorFailureException ex = new CollaboratorFailureException("Timed out", "event-bus");

        assertThat(ex.getMessage()).contains("Timed out").contains("event-bus");
        assertThat(ex.getCollaborator()).isEqualTo("event-bus");
    }

    @Test
    void collaboratorFailureShouldPreserveCause() {
        Throwable cause = new IllegalStateException("down");
        CollaboratorFailureException ex = new CollaboratorFailureException("Call failed", "metrics-source", cause);

        assertThat(ex.getCause()).isSameAs(cause);
    }
}
