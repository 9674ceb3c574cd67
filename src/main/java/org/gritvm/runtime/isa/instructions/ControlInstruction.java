package org.gritvm.runtime.isa.instructions;

import org.gritvm.runtime.Config;
import org.gritvm.runtime.internal.services.ExecutionContext;
import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.InstructionHandler;

/**
 * Handles NOOP, HALT, OUTPUT and the CHECKMEM assertion.
 */
public class ControlInstruction extends InstructionHandler {

    @Override
    public long execute(ExecutionContext context, Instruction instruction) {
        switch (instruction.operation()) {
            case NOOP -> {
                // nothing
            }
            case HALT -> context.getState().halt();
            case OUTPUT -> context.getOutputSink().emit(context.getState().getAccumulator());
            case CHECKMEM -> {
                int size = context.getMemory().size();
                // size == argument passes
                if (size < instruction.argument()) {
                    context.getState().instructionFailed("Memory size " + size + " is smaller than required " + instruction.argument());
                }
            }
            default -> {
                return unsupported(context, instruction);
            }
        }
        return Config.NEXT_INSTRUCTION;
    }
}
