package org.gritvm.runtime.model;

import org.gritvm.runtime.isa.Instruction;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The loaded program: a fixed array of instructions plus a cursor pointing at the current one.
 * <p>
 * The cursor may sit one position past the last instruction, which means the program ran off its
 * end. Moving backward never goes below the first instruction.
 */
public class InstructionStore {

    /**
     * The result of moving the cursor.
     */
    public enum AdvanceOutcome {
        /** The cursor points at an instruction. */
        MOVED,
        /** The cursor passed the last instruction. */
        PASSED_END,
        /** A distance of zero was requested. The cursor did not move. */
        INVALID_DISTANCE
    }

    private static final Instruction[] EMPTY = new Instruction[0];

    private Instruction[] instructions = EMPTY;
    private int cursor = 0;

    /**
     * Installs a new program and puts the cursor on its first instruction.
     *
     * @param program The decoded program.
     */
    public void install(List<Instruction> program) {
        Objects.requireNonNull(program, "program");
        this.instructions = program.toArray(EMPTY);
        for (Instruction instruction : instructions) {
            Objects.requireNonNull(instruction, "instruction");
        }
        this.cursor = 0;
    }

    public void clear() {
        this.instructions = EMPTY;
        this.cursor = 0;
    }

    public int size() {
        return instructions.length;
    }

    public boolean isEmpty() {
        return instructions.length == 0;
    }

    public void rewind() {
        this.cursor = 0;
    }

    public int getCursor() {
        return cursor;
    }

    /**
     * @return true if the cursor points past the last instruction.
     */
    public boolean isPastEnd() {
        return cursor >= instructions.length;
    }

    /**
     * Returns the instruction under the cursor.
     *
     * @return The current instruction.
     * @throws IllegalStateException if the cursor is past the end.
     */
    public Instruction current() {
        if (isPastEnd()) {
            throw new IllegalStateException("Cursor " + cursor + " is past the end of a program of " + instructions.length + " instructions");
        }
        return instructions[cursor];
    }

    /**
     * Moves the cursor by a relative distance.
     * <p>
     * A positive distance moves forward one step at a time and stops as soon as the cursor passes
     * the last instruction. A negative distance moves backward and clamps at the first instruction.
     *
     * @param distance The signed number of instructions to move.
     * @return The outcome of the move.
     */
    public AdvanceOutcome advance(long distance) {
        if (distance == 0) {
            return AdvanceOutcome.INVALID_DISTANCE;
        }
        long remaining = distance;
        while (remaining > 0 && cursor < instructions.length) {
            cursor++;
            remaining--;
        }
        while (remaining < 0 && cursor > 0) {
            cursor--;
            remaining++;
        }
        return isPastEnd() ? AdvanceOutcome.PASSED_END : AdvanceOutcome.MOVED;
    }

    /**
     * @return an unmodifiable view of the program in order.
     */
    public List<Instruction> listing() {
        return Collections.unmodifiableList(Arrays.asList(instructions));
    }
}
