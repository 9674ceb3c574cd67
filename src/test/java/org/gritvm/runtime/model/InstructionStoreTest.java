package org.gritvm.runtime.model;

import org.gritvm.runtime.isa.Instruction;
import org.gritvm.runtime.isa.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Pins the cursor movement rules: forward overflow passes the end, backward overflow clamps at the
 * first instruction.
 */
public class InstructionStoreTest {

    private InstructionStore store;

    @BeforeEach
    void setUp() {
        store = new InstructionStore();
        store.install(List.of(
                Instruction.of(Operation.NOOP),
                Instruction.of(Operation.ADDCONST, 1),
                Instruction.of(Operation.OUTPUT),
                Instruction.of(Operation.HALT)));
    }

    @Test
    @Tag("unit")
    void testInstallPutsCursorOnFirstInstruction() {
        assertThat(store.getCursor()).isZero();
        assertThat(store.current()).isEqualTo(Instruction.of(Operation.NOOP));
        assertThat(store.size()).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void testForwardMove() {
        assertThat(store.advance(2)).isEqualTo(InstructionStore.AdvanceOutcome.MOVED);
        assertThat(store.current().operation()).isEqualTo(Operation.OUTPUT);
    }

    @Test
    @Tag("unit")
    void testStepOntoLastInstructionIsNotPastEnd() {
        assertThat(store.advance(3)).isEqualTo(InstructionStore.AdvanceOutcome.MOVED);
        assertThat(store.current().operation()).isEqualTo(Operation.HALT);
    }

    @Test
    @Tag("unit")
    void testForwardOverflowPassesEnd() {
        assertThat(store.advance(1_000_000)).isEqualTo(InstructionStore.AdvanceOutcome.PASSED_END);
        assertThat(store.isPastEnd()).isTrue();
        assertThat(store.getCursor()).isEqualTo(4);
        assertThatThrownBy(store::current).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @Tag("unit")
    void testBackwardMove() {
        store.advance(3);
        assertThat(store.advance(-2)).isEqualTo(InstructionStore.AdvanceOutcome.MOVED);
        assertThat(store.getCursor()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testBackwardOverflowClampsAtFirstInstruction() {
        store.advance(2);
        assertThat(store.advance(Long.MIN_VALUE)).isEqualTo(InstructionStore.AdvanceOutcome.MOVED);
        assertThat(store.getCursor()).isZero();
    }

    @Test
    @Tag("unit")
    void testZeroDistanceIsRejectedWithoutMoving() {
        store.advance(1);
        assertThat(store.advance(0)).isEqualTo(InstructionStore.AdvanceOutcome.INVALID_DISTANCE);
        assertThat(store.getCursor()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testClearEmptiesProgram() {
        store.clear();
        assertThat(store.isEmpty()).isTrue();
        assertThat(store.listing()).isEmpty();
        assertThat(store.isPastEnd()).isTrue();
    }

    @Test
    @Tag("unit")
    void testListingIsReadOnly() {
        assertThatThrownBy(() -> store.listing().set(0, Instruction.of(Operation.HALT)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
