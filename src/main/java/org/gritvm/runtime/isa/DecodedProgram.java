package org.gritvm.runtime.isa;

import java.util.List;

/**
 * A whole decoded program: either every instruction, or the first line that failed to decode.
 *
 * @param instructions The instructions decoded before the failure, or all of them.
 * @param failure The first decode failure, or null.
 */
public record DecodedProgram(List<Instruction> instructions, DecodeResult.Failure failure) {

    public DecodedProgram {
        instructions = List.copyOf(instructions);
    }

    public static DecodedProgram of(List<Instruction> instructions) {
        return new DecodedProgram(instructions, null);
    }

    public static DecodedProgram failed(List<Instruction> decodedSoFar, DecodeResult.Failure failure) {
        return new DecodedProgram(decodedSoFar, failure);
    }

    public boolean isSuccessful() {
        return failure == null;
    }
}
