package org.gritvm.runtime.isa.instructions;

import org.gritvm.runtime.Config;
import org.gritvm.runtime.internal.services.ExecutionContext;
import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.InstructionHandler;
import org.gritvm.runtime.model.MachineState;

/**
 * Handles CLEAR, AT and SET, which move values between the accumulator and memory.
 */
public class TransferInstruction extends InstructionHandler {

    @Override
    public long execute(ExecutionContext context, Instruction instruction) {
        MachineState state = context.getState();
        long location = instruction.argument();

        switch (instruction.operation()) {
            case CLEAR -> state.setAccumulator(0L);
            case AT -> {
                if (requireValidLocation(context, location)) {
                    state.setAccumulator(context.getMemory().get(location));
                }
            }
            case SET -> {
                if (requireValidLocation(context, location)) {
                    context.getMemory().set(location, state.getAccumulator());
                }
            }
            default -> {
                return unsupported(context, instruction);
            }
        }
        return Config.NEXT_INSTRUCTION;
    }
}
