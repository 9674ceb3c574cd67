package org.gritvm.runtime.services;

import org.gritvm.runtime.VirtualMachine;
import org.gritvm.runtime.isa.Instruction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Produces diagnostic views of a machine. Nothing here affects execution.
 */
public class MachineInspector {

    /**
     * Captures the current state of a machine.
     *
     * @param vm The machine to inspect.
     * @return The snapshot.
     */
    public MachineSnapshot snapshot(VirtualMachine vm) {
        List<String> listing = vm.getInstructions().stream()
                .map(Instruction::toString)
                .collect(Collectors.toList());
        return new MachineSnapshot(
                vm.getStatus(),
                vm.getAccumulator(),
                vm.getDataMemory(),
                listing,
                vm.getFailureReason().orElse(null));
    }

    /**
     * Renders a snapshot as human-readable text, one item per line.
     *
     * @param snapshot The snapshot.
     * @param printData Whether to include the data memory.
     * @param printInstructions Whether to include the instruction listing.
     * @return The text.
     */
    public String render(MachineSnapshot snapshot, boolean printData, boolean printInstructions) {
        StringBuilder sb = new StringBuilder();
        sb.append("Status: ").append(snapshot.status()).append('\n');
        if (snapshot.failureReason() != null) {
            sb.append("Failure: ").append(snapshot.failureReason()).append('\n');
        }
        sb.append("Accumulator: ").append(snapshot.accumulator()).append('\n');

        if (printData) {
            sb.append("*** Data Memory ***\n");
            List<Long> memory = snapshot.dataMemory();
            for (int i = 0; i < memory.size(); i++) {
                sb.append("Location ").append(i).append(": ").append(memory.get(i)).append('\n');
            }
        }
        if (printInstructions) {
            sb.append("*** Instruction Memory ***\n");
            List<String> instructions = snapshot.instructions();
            for (int i = 0; i < instructions.size(); i++) {
                sb.append("Instruction ").append(i).append(": ").append(instructions.get(i)).append('\n');
            }
        }
        return sb.toString();
    }
}
