package org.gritvm.runtime;

import com.typesafe.config.ConfigException;

/**
 * Tunable options of a {@link VirtualMachine}.
 *
 * @param maxSteps The maximum number of instructions a single run may evaluate, or
 *                 {@link Config#UNLIMITED_STEPS} for no limit.
 */
public record MachineOptions(long maxSteps) {

    private static final String MAX_STEPS_KEY = "max-steps";

    /**
     * Validates the options.
     */
    public MachineOptions {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("max-steps must not be negative, was " + maxSteps);
        }
    }

    /**
     * @return options without a step budget.
     */
    public static MachineOptions defaults() {
        return new MachineOptions(Config.UNLIMITED_STEPS);
    }

    /**
     * Reads the options from the {@code gritvm.runtime} block of the given configuration.
     * Missing keys fall back to the defaults.
     *
     * @param config The application configuration.
     * @return The machine options.
     * @throws ConfigException.BadValue if {@code max-steps} is negative.
     */
    public static MachineOptions fromConfig(com.typesafe.config.Config config) {
        if (!config.hasPath(Config.RUNTIME_CONFIG_PATH)) {
            return defaults();
        }
        com.typesafe.config.Config runtime = config.getConfig(Config.RUNTIME_CONFIG_PATH);
        if (!runtime.hasPath(MAX_STEPS_KEY)) {
            return defaults();
        }
        long maxSteps = runtime.getLong(MAX_STEPS_KEY);
        if (maxSteps < 0) {
            throw new ConfigException.BadValue(runtime.getValue(MAX_STEPS_KEY).origin(),
                    Config.RUNTIME_CONFIG_PATH + "." + MAX_STEPS_KEY, "must not be negative, was " + maxSteps);
        }
        return new MachineOptions(maxSteps);
    }

    /**
     * @return true if a step budget is configured.
     */
    public boolean isBounded() {
        return maxSteps != Config.UNLIMITED_STEPS;
    }

    /**
     * Returns a copy with a different step budget.
     *
     * @param maxSteps The new budget.
     * @return The new options.
     */
    public MachineOptions withMaxSteps(long maxSteps) {
        return new MachineOptions(maxSteps);
    }
}
