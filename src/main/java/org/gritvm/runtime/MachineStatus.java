package org.gritvm.runtime;

/**
 * The lifecycle states of a {@link VirtualMachine}.
 * <p>
 * A machine starts in {@link #WAITING}, becomes {@link #READY} once a non-empty program is loaded,
 * is {@link #RUNNING} while executing and ends in one of the terminal states {@link #HALTED} or
 * {@link #ERRORED}. Only a reset leaves a terminal state.
 */
public enum MachineStatus {
    /** No program loaded, accepts a load. */
    WAITING,
    /** Program loaded, accepts a run. */
    READY,
    /** Executing. Never observable from outside a run. */
    RUNNING,
    /** Terminated normally. */
    HALTED,
    /** Terminated abnormally. */
    ERRORED;

    /**
     * @return true for {@link #HALTED} and {@link #ERRORED}.
     */
    public boolean isTerminal() {
        return this == HALTED || this == ERRORED;
    }
}
