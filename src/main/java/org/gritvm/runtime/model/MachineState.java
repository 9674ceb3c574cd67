package org.gritvm.runtime.model;

import org.gritvm.runtime.MachineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The mutable state instructions operate on: the accumulator, the data memory and the machine
 * status, plus the reason of the last failure.
 * <p>
 * Instructions report errors through {@link #instructionFailed(String)}, which moves the machine
 * to {@link MachineStatus#ERRORED}. Only the first failure of a run is recorded.
 */
public class MachineState {
    private static final Logger LOG = LoggerFactory.getLogger(MachineState.class);

    private final DataMemory dataMemory = new DataMemory();
    private long accumulator = 0L;
    private MachineStatus status = MachineStatus.WAITING;
    private String failureReason = null;

    public long getAccumulator() {
        return accumulator;
    }

    public void setAccumulator(long accumulator) {
        this.accumulator = accumulator;
    }

    public DataMemory getDataMemory() {
        return dataMemory;
    }

    public MachineStatus getStatus() {
        return status;
    }

    /**
     * Sets the machine status.
     *
     * @param status The new status.
     */
    public void setStatus(MachineStatus status) {
        if (this.status != status) {
            LOG.debug("Status {} -> {}", this.status, status);
            this.status = status;
        }
    }

    /**
     * @return true while the machine is executing.
     */
    public boolean isRunning() {
        return status == MachineStatus.RUNNING;
    }

    /**
     * Marks the current instruction as failed and moves the machine to ERRORED.
     *
     * @param reason The reason for the failure.
     */
    public void instructionFailed(String reason) {
        if (this.failureReason == null) {
            this.failureReason = reason;
        }
        LOG.debug("Instruction failed: {}", reason);
        setStatus(MachineStatus.ERRORED);
    }

    /**
     * Stops the machine normally.
     */
    public void halt() {
        setStatus(MachineStatus.HALTED);
    }

    /**
     * @return the reason of the first failure, if the machine failed.
     */
    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * Clears the accumulator, the memory and the failure reason, and returns to WAITING.
     */
    public void reset() {
        this.accumulator = 0L;
        this.dataMemory.clear();
        this.failureReason = null;
        setStatus(MachineStatus.WAITING);
    }
}
