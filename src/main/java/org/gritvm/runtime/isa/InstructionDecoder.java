package org.gritvm.runtime.isa;

import org.gritvm.runtime.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes program text into instructions.
 * <p>
 * Each non-blank, non-comment line holds one instruction: a case-insensitive mnemonic optionally
 * followed by a signed decimal argument, e.g. {@code ADDCONST -5}. Operations without an argument
 * ({@code CLEAR}, {@code NOOP}, {@code HALT}, {@code OUTPUT}) must not carry one. Lines whose first
 * non-blank character is {@code #} are comments.
 */
public class InstructionDecoder {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Decodes a single line.
     *
     * @param lineNumber The 1-based line number, used for failure reporting.
     * @param line The raw line.
     * @return The decode result, or empty if the line is blank or a comment.
     */
    public Optional<DecodeResult> decodeLine(int lineNumber, String line) {
        Objects.requireNonNull(line, "line");
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.charAt(0) == Config.COMMENT_PREFIX) {
            return Optional.empty();
        }

        String[] tokens = WHITESPACE.split(trimmed);
        Optional<Operation> operation = Operation.fromMnemonic(tokens[0]);
        if (operation.isEmpty()) {
            return Optional.of(new DecodeResult.Failure(lineNumber, line, "Unknown operation '" + tokens[0] + "'"));
        }

        Operation op = operation.get();
        if (!op.takesArgument()) {
            if (tokens.length != 1) {
                return Optional.of(new DecodeResult.Failure(lineNumber, line, op.mnemonic() + " takes no argument"));
            }
            return Optional.of(new DecodeResult.Decoded(Instruction.of(op)));
        }

        if (tokens.length != 2) {
            return Optional.of(new DecodeResult.Failure(lineNumber, line, op.mnemonic() + " requires exactly one argument"));
        }
        try {
            long argument = Long.parseLong(tokens[1]);
            return Optional.of(new DecodeResult.Decoded(Instruction.of(op, argument)));
        } catch (NumberFormatException e) {
            return Optional.of(new DecodeResult.Failure(lineNumber, line, "Invalid argument '" + tokens[1] + "'"));
        }
    }

    /**
     * Decodes a whole program, stopping at the first line that fails to decode.
     *
     * @param lines The program text, one instruction per line.
     * @return The decoded program.
     */
    public DecodedProgram decodeProgram(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<Instruction> instructions = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            Optional<DecodeResult> result = decodeLine(lineNumber, line);
            if (result.isEmpty()) {
                continue;
            }
            DecodeResult decoded = result.get();
            if (decoded instanceof DecodeResult.Failure failure) {
                return DecodedProgram.failed(instructions, failure);
            }
            instructions.add(((DecodeResult.Decoded) decoded).instruction());
        }
        return DecodedProgram.of(instructions);
    }
}
