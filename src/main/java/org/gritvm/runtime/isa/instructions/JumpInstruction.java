package org.gritvm.runtime.isa.instructions;

import org.gritvm.runtime.Config;
import org.gritvm.runtime.internal.services.ExecutionContext;
import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.InstructionHandler;

/**
 * Handles the relative jumps JUMPREL, JUMPZERO and JUMPNZERO.
 * The argument is the signed distance to move the cursor by when the jump is taken.
 * A distance of zero is rejected whether or not the jump would be taken.
 */
public class JumpInstruction extends InstructionHandler {

    @Override
    public long execute(ExecutionContext context, Instruction instruction) {
        long distance = instruction.argument();
        if (distance == 0) {
            context.getState().instructionFailed("Jump distance must not be zero.");
            return Config.NEXT_INSTRUCTION;
        }

        long accumulator = context.getState().getAccumulator();
        return switch (instruction.operation()) {
            case JUMPREL -> distance;
            case JUMPZERO -> accumulator == 0 ? distance : Config.NEXT_INSTRUCTION;
            case JUMPNZERO -> accumulator != 0 ? distance : Config.NEXT_INSTRUCTION;
            default -> unsupported(context, instruction);
        };
    }
}
