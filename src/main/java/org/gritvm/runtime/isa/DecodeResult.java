package org.gritvm.runtime.isa;

import java.util.Objects;

/**
 * The outcome of decoding one line of program text. A failure is never an {@link Instruction}.
 */
public sealed interface DecodeResult permits DecodeResult.Decoded, DecodeResult.Failure {

    /**
     * A successfully decoded line.
     * @param instruction The instruction.
     */
    record Decoded(Instruction instruction) implements DecodeResult {
        public Decoded {
            Objects.requireNonNull(instruction, "instruction");
        }
    }

    /**
     * A line that could not be decoded.
     * @param lineNumber The 1-based line number.
     * @param text The raw line.
     * @param reason Why decoding failed.
     */
    record Failure(int lineNumber, String text, String reason) implements DecodeResult {
        @Override
        public String toString() {
            return String.format("line %d: %s ('%s')", lineNumber, reason, text);
        }
    }
}
