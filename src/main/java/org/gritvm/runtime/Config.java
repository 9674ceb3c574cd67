package org.gritvm.runtime;

/**
 * Static constants of the GritVM runtime.
 * This final class is not meant to be instantiated. Tunable settings live in
 * {@link MachineOptions}, which is loaded from HOCON configuration.
 */
public final class Config {

    private Config() {}

    /**
     * The distance a non-jump instruction advances the cursor by.
     */
    public static final long NEXT_INSTRUCTION = 1L;

    /**
     * Step budget value meaning "no limit".
     */
    public static final long UNLIMITED_STEPS = 0L;

    /**
     * Lines of program text starting with this character (after leading whitespace) are comments.
     */
    public static final char COMMENT_PREFIX = '#';

    /**
     * Name of the SLF4J logger that receives OUTPUT values from the default output sink.
     */
    public static final String OUTPUT_LOGGER_NAME = "org.gritvm.runtime.output";

    /**
     * The configuration path holding the runtime options.
     */
    public static final String RUNTIME_CONFIG_PATH = "gritvm.runtime";
}
