package org.gritvm.runtime.isa;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of operations the machine understands.
 */
public enum Operation {
    CLEAR(Family.TRANSFER, false),
    AT(Family.TRANSFER, true),
    SET(Family.TRANSFER, true),

    INSERT(Family.MEMORY_SHAPE, true),
    ERASE(Family.MEMORY_SHAPE, true),

    ADDCONST(Family.CONSTANT_ARITHMETIC, true),
    SUBCONST(Family.CONSTANT_ARITHMETIC, true),
    MULCONST(Family.CONSTANT_ARITHMETIC, true),
    DIVCONST(Family.CONSTANT_ARITHMETIC, true),

    ADDMEM(Family.MEMORY_ARITHMETIC, true),
    SUBMEM(Family.MEMORY_ARITHMETIC, true),
    MULMEM(Family.MEMORY_ARITHMETIC, true),
    DIVMEM(Family.MEMORY_ARITHMETIC, true),

    JUMPREL(Family.JUMP, true),
    JUMPZERO(Family.JUMP, true),
    JUMPNZERO(Family.JUMP, true),

    NOOP(Family.CONTROL, false),
    HALT(Family.CONTROL, false),
    OUTPUT(Family.CONTROL, false),
    CHECKMEM(Family.CONTROL, true);

    /**
     * Groups operations that share an argument meaning and an implementation.
     */
    public enum Family {
        /** Accumulator/memory transfer. The argument is a memory location. */
        TRANSFER,
        /** Insertion into and removal from memory. The argument is a memory location. */
        MEMORY_SHAPE,
        /** Arithmetic with a constant. The argument is the constant. */
        CONSTANT_ARITHMETIC,
        /** Arithmetic with a memory cell. The argument is a memory location. */
        MEMORY_ARITHMETIC,
        /** Relative jumps. The argument is a jump distance. */
        JUMP,
        /** Control and diagnostics. */
        CONTROL
    }

    private final Family family;
    private final boolean takesArgument;

    Operation(Family family, boolean takesArgument) {
        this.family = family;
        this.takesArgument = takesArgument;
    }

    public Family getFamily() {
        return family;
    }

    /**
     * @return true if the operation carries an argument in program text.
     */
    public boolean takesArgument() {
        return takesArgument;
    }

    /**
     * @return the mnemonic used in program text.
     */
    public String mnemonic() {
        return name();
    }

    /**
     * Looks up an operation by its mnemonic, ignoring case.
     *
     * @param mnemonic The mnemonic, e.g. "addconst".
     * @return The operation, or empty if the mnemonic is unknown.
     */
    public static Optional<Operation> fromMnemonic(String mnemonic) {
        if (mnemonic == null || mnemonic.isEmpty()) {
            return Optional.empty();
        }
        String upper = mnemonic.toUpperCase(Locale.ROOT);
        for (Operation operation : values()) {
            if (operation.name().equals(upper)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
