package com.pgcrond.engine;

/**
 * Enum representing the states of one job's execution pipeline.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>RESOLVING → DISPATCHING: DSN and password resolved</li>
 *   <li>RESOLVING → SKIPPED: database or user missing, or unknown job type</li>
 *   <li>RESOLVING → REPORTING: the password store could not be read</li>
 *   <li>DISPATCHING → EVALUATING: the handler returned its output</li>
 *   <li>DISPATCHING → REPORTING: the handler failed</li>
 *   <li>EVALUATING → REPORTING: the notification policy found the output notable</li>
 *   <li>EVALUATING → DONE: nothing to report</li>
 *   <li>REPORTING → DONE: report handed to the notifier (or its failure logged)</li>
 * </ul>
 *
 * @see JobExecution
 */
public enum ExecutionState {
    RESOLVING,
    DISPATCHING,
    EVALUATING,
    REPORTING,
    DONE,
    SKIPPED;

    /**
     * Check if this state ends the pipeline.
     */
    public boolean isTerminal() {
        return this == DONE || this == SKIPPED;
    }

    /**
     * Validate if a transition to a new state is legal.
     *
     * @param next the target state
     * @return true if the pipeline may move from this state to {@code next}
     */
    public boolean canTransitionTo(ExecutionState next) {
        if (this.isTerminal()) {
            return false;
        }
        return switch (this) {
            case RESOLVING -> next == DISPATCHING || next == SKIPPED || next == REPORTING;
            case DISPATCHING -> next == EVALUATING || next == REPORTING;
            case EVALUATING -> next == REPORTING || next == DONE;
            case REPORTING -> next == DONE;
            default -> false;
        };
    }
}
