package org.gritvm.runtime.api;

/**
 * Thrown when a program source cannot be read at all, before any machine state is touched.
 * <p>
 * This is distinct from a program that can be read but fails to decode, which the machine reports
 * through its ERRORED status.
 */
public class ProgramSourceException extends Exception {

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ProgramSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
