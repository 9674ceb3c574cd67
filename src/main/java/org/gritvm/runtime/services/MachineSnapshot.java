package org.gritvm.runtime.services;

import org.gritvm.runtime.MachineStatus;

import java.util.List;

/**
 * A point-in-time copy of a machine's observable state, for diagnostics only.
 *
 * @param status The machine status.
 * @param accumulator The accumulator value.
 * @param dataMemory The data memory contents.
 * @param instructions The loaded program in text form, one entry per instruction.
 * @param failureReason Why the machine failed, or null.
 */
public record MachineSnapshot(
        MachineStatus status,
        long accumulator,
        List<Long> dataMemory,
        List<String> instructions,
        String failureReason
) {
    public MachineSnapshot {
        dataMemory = List.copyOf(dataMemory);
        instructions = List.copyOf(instructions);
    }
}
