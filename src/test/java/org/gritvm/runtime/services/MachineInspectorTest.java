package org.gritvm.runtime.services;

import org.gritvm.runtime.MachineStatus;
import org.gritvm.runtime.VirtualMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class MachineInspectorTest {

    private VirtualMachine vm;
    private MachineInspector inspector;

    @BeforeEach
    void setUp() {
        vm = new VirtualMachine(value -> { });
        inspector = new MachineInspector();
    }

    @Test
    @Tag("unit")
    void testSnapshotCapturesState() {
        vm.load(List.of("SET 0", "ADDCONST 5", "OUTPUT", "HALT"), List.of(0L));
        vm.run();

        MachineSnapshot snapshot = inspector.snapshot(vm);

        assertThat(snapshot.status()).isEqualTo(MachineStatus.HALTED);
        assertThat(snapshot.accumulator()).isEqualTo(5L);
        assertThat(snapshot.dataMemory()).containsExactly(0L);
        assertThat(snapshot.instructions()).containsExactly("SET 0", "ADDCONST 5", "OUTPUT", "HALT");
        assertThat(snapshot.failureReason()).isNull();
    }

    @Test
    @Tag("unit")
    void testRenderFullReport() {
        vm.load(List.of("SET 0", "ADDCONST 5", "OUTPUT", "HALT"), List.of(0L));
        vm.run();

        String text = inspector.render(inspector.snapshot(vm), true, true);

        assertThat(text).isEqualTo(
                "Status: HALTED\n"
                + "Accumulator: 5\n"
                + "*** Data Memory ***\n"
                + "Location 0: 0\n"
                + "*** Instruction Memory ***\n"
                + "Instruction 0: SET 0\n"
                + "Instruction 1: ADDCONST 5\n"
                + "Instruction 2: OUTPUT\n"
                + "Instruction 3: HALT\n");
    }

    @Test
    @Tag("unit")
    void testRenderWithoutSectionsIncludesFailure() {
        vm.load(List.of("ADDCONST 2", "DIVCONST 0"), List.of(1L));
        vm.run();

        String text = inspector.render(inspector.snapshot(vm), false, false);

        assertThat(text).startsWith("Status: ERRORED\nFailure: Division by zero.\n");
        assertThat(text).endsWith("Accumulator: 2\n");
        assertThat(text).doesNotContain("*** Data Memory ***", "*** Instruction Memory ***");
    }

    @Test
    @Tag("unit")
    void testSnapshotIsDetachedFromMachine() {
        vm.load(List.of("ADDCONST 1", "SET 0"), List.of(0L));
        MachineSnapshot before = inspector.snapshot(vm);
        vm.run();
        assertThat(before.status()).isEqualTo(MachineStatus.READY);
        assertThat(before.dataMemory()).containsExactly(0L);
    }
}
