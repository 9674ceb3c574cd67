package org.gritvm.runtime.isa;

import java.util.Objects;

/**
 * A decoded instruction: an operation and its signed argument.
 * Operations without an argument carry 0.
 *
 * @param operation The operation.
 * @param argument The argument: a memory location, a constant or a jump distance.
 */
public record Instruction(Operation operation, long argument) {

    public Instruction {
        Objects.requireNonNull(operation, "operation");
    }

    /**
     * Creates an instruction for an operation that takes no argument.
     *
     * @param operation The operation.
     * @return The instruction.
     */
    public static Instruction of(Operation operation) {
        return new Instruction(operation, 0L);
    }

    public static Instruction of(Operation operation, long argument) {
        return new Instruction(operation, argument);
    }

    /**
     * @return the instruction in program text form, e.g. "ADDCONST 5" or "HALT".
     */
    @Override
    public String toString() {
        return operation.takesArgument() ? operation.mnemonic() + " " + argument : operation.mnemonic();
    }
}
