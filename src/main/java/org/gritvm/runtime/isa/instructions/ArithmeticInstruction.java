package org.gritvm.runtime.isa.instructions;

import org.gritvm.runtime.Config;
import org.gritvm.runtime.internal.services.ExecutionContext;
import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.InstructionHandler;
import org.gritvm.runtime.isa.Operation;
import org.gritvm.runtime.model.MachineState;

/**
 * Handles the arithmetic instructions. The {@code *CONST} variants use the argument as operand,
 * the {@code *MEM} variants use the memory cell the argument points to.
 * All arithmetic is signed 64-bit and wraps around on overflow.
 */
public class ArithmeticInstruction extends InstructionHandler {

    @Override
    public long execute(ExecutionContext context, Instruction instruction) {
        MachineState state = context.getState();
        Operation operation = instruction.operation();

        long operand;
        if (operation.getFamily() == Operation.Family.MEMORY_ARITHMETIC) {
            if (!requireValidLocation(context, instruction.argument())) {
                return Config.NEXT_INSTRUCTION;
            }
            operand = context.getMemory().get(instruction.argument());
        } else if (operation.getFamily() == Operation.Family.CONSTANT_ARITHMETIC) {
            operand = instruction.argument();
        } else {
            return unsupported(context, instruction);
        }

        long accumulator = state.getAccumulator();
        switch (operation) {
            case ADDCONST, ADDMEM -> state.setAccumulator(accumulator + operand);
            case SUBCONST, SUBMEM -> state.setAccumulator(accumulator - operand);
            case MULCONST, MULMEM -> state.setAccumulator(accumulator * operand);
            case DIVCONST, DIVMEM -> {
                if (operand == 0) {
                    state.instructionFailed("Division by zero.");
                    return Config.NEXT_INSTRUCTION;
                }
                // Long.MIN_VALUE / -1 wraps to Long.MIN_VALUE
                state.setAccumulator(accumulator / operand);
            }
            default -> {
                return unsupported(context, instruction);
            }
        }
        return Config.NEXT_INSTRUCTION;
    }
}
