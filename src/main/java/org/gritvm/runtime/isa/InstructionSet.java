package org.gritvm.runtime.isa;

import org.gritvm.runtime.isa.instructions.ArithmeticInstruction;
import org.gritvm.runtime.isa.instructions.ControlInstruction;
import org.gritvm.runtime.isa.instructions.JumpInstruction;
import org.gritvm.runtime.isa.instructions.MemoryShapeInstruction;
import org.gritvm.runtime.isa.instructions.TransferInstruction;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps every operation to the instruction family implementing it.
 */
public class InstructionSet {

    private final Map<Operation, InstructionHandler> handlers = new EnumMap<>(Operation.class);

    /**
     * Creates the instruction set with every operation registered.
     *
     * @return The standard instruction set.
     */
    public static InstructionSet standard() {
        InstructionSet set = new InstructionSet();
        // Transfer-Family
        set.registerFamily(new TransferInstruction(), EnumSet.of(Operation.CLEAR, Operation.AT, Operation.SET));
        // MemoryShape-Family
        set.registerFamily(new MemoryShapeInstruction(), EnumSet.of(Operation.INSERT, Operation.ERASE));
        // Arithmetic-Family
        set.registerFamily(new ArithmeticInstruction(), EnumSet.of(
                Operation.ADDCONST, Operation.SUBCONST, Operation.MULCONST, Operation.DIVCONST,
                Operation.ADDMEM, Operation.SUBMEM, Operation.MULMEM, Operation.DIVMEM));
        // Jump-Family
        set.registerFamily(new JumpInstruction(), EnumSet.of(Operation.JUMPREL, Operation.JUMPZERO, Operation.JUMPNZERO));
        // Control-Family
        set.registerFamily(new ControlInstruction(), EnumSet.of(Operation.NOOP, Operation.HALT, Operation.OUTPUT, Operation.CHECKMEM));
        return set;
    }

    /**
     * Registers a family for a set of operations, replacing any earlier registration.
     *
     * @param handler The family implementation.
     * @param operations The operations it handles.
     * @return this instruction set.
     */
    public InstructionSet registerFamily(InstructionHandler handler, Set<Operation> operations) {
        Objects.requireNonNull(handler, "handler");
        for (Operation operation : operations) {
            handlers.put(operation, handler);
        }
        return this;
    }

    /**
     * @param operation The operation.
     * @return the family handling it, or empty if none is registered.
     */
    public Optional<InstructionHandler> handlerFor(Operation operation) {
        return Optional.ofNullable(handlers.get(operation));
    }
}
