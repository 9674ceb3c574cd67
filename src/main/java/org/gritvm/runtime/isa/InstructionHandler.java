package org.gritvm.runtime.isa;

import org.gritvm.runtime.Config;
import org.gritvm.runtime.internal.services.ExecutionContext;

/**
 * The abstract base class for all instruction families.
 * <p>
 * A family implements the semantics of a group of related operations. Implementations must check
 * every precondition before mutating state, so that a failed instruction leaves the machine exactly
 * as it found it.
 */
public abstract class InstructionHandler {

    /**
     * Executes an instruction against the machine state.
     *
     * @param context The execution context.
     * @param instruction The instruction to execute. Its operation belongs to this family.
     * @return The signed distance to move the cursor by. Ignored if the machine is no longer running.
     */
    public abstract long execute(ExecutionContext context, Instruction instruction);

    /**
     * Reports an operation this family was registered for but does not implement.
     *
     * @param context The execution context.
     * @param instruction The offending instruction.
     * @return {@link Config#NEXT_INSTRUCTION}.
     */
    protected long unsupported(ExecutionContext context, Instruction instruction) {
        context.getState().instructionFailed("Unsupported operation " + instruction.operation() + " for " + getClass().getSimpleName());
        return Config.NEXT_INSTRUCTION;
    }

    /**
     * Checks strict memory validity and fails the instruction if the location is out of range.
     *
     * @param context The execution context.
     * @param location The location to check.
     * @return true if the location is valid.
     */
    protected boolean requireValidLocation(ExecutionContext context, long location) {
        if (!context.getMemory().isValid(location)) {
            context.getState().instructionFailed("Memory location " + location + " out of range for size " + context.getMemory().size());
            return false;
        }
        return true;
    }
}
