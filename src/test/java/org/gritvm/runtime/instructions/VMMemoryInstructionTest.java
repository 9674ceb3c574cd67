package org.gritvm.runtime.instructions;

import org.gritvm.runtime.MachineStatus;
import org.gritvm.runtime.VirtualMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Covers the transfer (CLEAR, AT, SET) and memory shape (INSERT, ERASE) instructions and their
 * index boundaries.
 */
public class VMMemoryInstructionTest {

    private VirtualMachine vm;

    @BeforeEach
    void setUp() {
        vm = new VirtualMachine(value -> { });
    }

    private MachineStatus run(List<Long> memory, String... program) {
        vm.load(List.of(program), memory);
        return vm.run();
    }

    // --- Transfer ---
    @Test
    @Tag("unit")
    void testClear() {
        run(List.of(), "ADDCONST 5", "CLEAR");
        assertThat(vm.getAccumulator()).isZero();
    }

    @Test
    @Tag("unit")
    void testAt() {
        assertThat(run(List.of(10L, 20L), "AT 1")).isEqualTo(MachineStatus.HALTED);
        assertThat(vm.getAccumulator()).isEqualTo(20L);
    }

    @Test
    @Tag("unit")
    void testAtSizeFails() {
        assertThat(run(List.of(1L, 2L), "AT 2")).isEqualTo(MachineStatus.ERRORED);
        assertThat(vm.getAccumulator()).isZero();
    }

    @Test
    @Tag("unit")
    void testSet() {
        run(List.of(0L, 0L), "ADDCONST 5", "SET 1");
        assertThat(vm.getDataMemory()).containsExactly(0L, 5L);
    }

    @Test
    @Tag("unit")
    void testSetSizeFailsWithoutMutation() {
        assertThat(run(List.of(1L), "ADDCONST 5", "SET 1")).isEqualTo(MachineStatus.ERRORED);
        assertThat(vm.getDataMemory()).containsExactly(1L);
    }

    // --- Memory shape ---
    @Test
    @Tag("unit")
    void testInsertAtFront() {
        run(List.of(1L, 2L), "ADDCONST 7", "INSERT 0");
        assertThat(vm.getDataMemory()).containsExactly(7L, 1L, 2L);
    }

    @Test
    @Tag("unit")
    void testInsertAtSizeAppends() {
        assertThat(run(List.of(1L, 2L), "ADDCONST 7", "INSERT 2")).isEqualTo(MachineStatus.HALTED);
        assertThat(vm.getDataMemory()).containsExactly(1L, 2L, 7L);
    }

    @Test
    @Tag("unit")
    void testInsertIntoEmptyMemory() {
        run(List.of(), "ADDCONST 3", "INSERT 0", "INSERT 0");
        assertThat(vm.getDataMemory()).containsExactly(3L, 3L);
    }

    @Test
    @Tag("unit")
    void testInsertBeyondSizeFailsWithoutMutation() {
        assertThat(run(List.of(1L, 2L), "ADDCONST 7", "INSERT 3")).isEqualTo(MachineStatus.ERRORED);
        assertThat(vm.getDataMemory()).containsExactly(1L, 2L);
    }

    @Test
    @Tag("unit")
    void testInsertNegativeFails() {
        assertThat(run(List.of(1L), "INSERT -1")).isEqualTo(MachineStatus.ERRORED);
        assertThat(vm.getDataMemory()).containsExactly(1L);
    }

    @Test
    @Tag("unit")
    void testErase() {
        run(List.of(1L, 2L, 3L), "ERASE 1");
        assertThat(vm.getDataMemory()).containsExactly(1L, 3L);
    }

    @Test
    @Tag("unit")
    void testEraseSizeFailsWithoutMutation() {
        assertThat(run(List.of(1L, 2L), "ERASE 2")).isEqualTo(MachineStatus.ERRORED);
        assertThat(vm.getDataMemory()).containsExactly(1L, 2L);
    }

    @Test
    @Tag("unit")
    void testEraseThenStrictAccessSeesNewSize() {
        assertThat(run(List.of(1L, 2L), "ERASE 0", "AT 1")).isEqualTo(MachineStatus.ERRORED);
        assertThat(vm.getDataMemory()).containsExactly(2L);
    }

    @Test
    @Tag("unit")
    void testStateBeforeFailureIsKept() {
        assertThat(run(List.of(0L), "ADDCONST 4", "SET 0", "AT 5", "ADDCONST 100")).isEqualTo(MachineStatus.ERRORED);
        assertThat(vm.getAccumulator()).isEqualTo(4L);
        assertThat(vm.getDataMemory()).containsExactly(4L);
    }
}
