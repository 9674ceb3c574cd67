package org.gritvm.runtime.internal.services;

import org.gritvm.runtime.Config;
import org.gritvm.runtime.spi.IOutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default output sink. Writes every OUTPUT value to a dedicated SLF4J logger at INFO level.
 */
public class LoggingOutputSink implements IOutputSink {

    private static final Logger OUTPUT = LoggerFactory.getLogger(Config.OUTPUT_LOGGER_NAME);

    @Override
    public void emit(long value) {
        OUTPUT.info("{}", value);
    }
}
