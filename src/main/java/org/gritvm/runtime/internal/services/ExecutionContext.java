package org.gritvm.runtime.internal.services;

import org.gritvm.runtime.model.DataMemory;
import org.gritvm.runtime.model.MachineState;
import org.gritvm.runtime.spi.IOutputSink;

/**
 * Encapsulates everything an instruction may touch while it executes.
 * This object is created by the VirtualMachine and passed to the instruction
 * families to avoid global access.
 */
public class ExecutionContext {

    private final MachineState state;
    private final IOutputSink outputSink;

    /**
     * Constructs a new ExecutionContext.
     * @param state The machine state the instruction operates on.
     * @param outputSink The receiver of OUTPUT values.
     */
    public ExecutionContext(MachineState state, IOutputSink outputSink) {
        this.state = state;
        this.outputSink = outputSink;
    }

    public MachineState getState() {
        return state;
    }

    /**
     * Shortcut for {@code getState().getDataMemory()}.
     * @return The data memory.
     */
    public DataMemory getMemory() {
        return state.getDataMemory();
    }

    public IOutputSink getOutputSink() {
        return outputSink;
    }
}
