package org.gritvm.runtime.isa.instructions;

import org.gritvm.runtime.Config;
import org.gritvm.runtime.internal.services.ExecutionContext;
import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.InstructionHandler;
import org.gritvm.runtime.model.DataMemory;

/**
 * Handles INSERT and ERASE, the only instructions that change the size of memory.
 */
public class MemoryShapeInstruction extends InstructionHandler {

    @Override
    public long execute(ExecutionContext context, Instruction instruction) {
        DataMemory memory = context.getMemory();
        long location = instruction.argument();

        switch (instruction.operation()) {
            case INSERT -> {
                if (!memory.isInsertable(location)) {
                    context.getState().instructionFailed("Insert location " + location + " out of range for size " + memory.size());
                    return Config.NEXT_INSTRUCTION;
                }
                memory.insert(location, context.getState().getAccumulator());
            }
            case ERASE -> {
                if (requireValidLocation(context, location)) {
                    memory.erase(location);
                }
            }
            default -> {
                return unsupported(context, instruction);
            }
        }
        return Config.NEXT_INSTRUCTION;
    }
}
