package org.gritvm.runtime.spi;

/**
 * Receives the values written by the OUTPUT instruction, in execution order.
 */
@FunctionalInterface
public interface IOutputSink {

    /**
     * Called once per executed OUTPUT instruction.
     *
     * @param value the accumulator value at the time of the OUTPUT
     */
    void emit(long value);
}
