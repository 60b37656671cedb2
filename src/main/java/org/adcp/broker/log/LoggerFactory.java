package org.adcp.broker.log;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.spi.ExtendedLogger;

public class LoggerFactory {

    private LoggerFactory() {
    }

    public static Logger getLogger(Class<?> clazz) {
        return new Logger((ExtendedLogger) LogManager.getLogger(clazz.getCanonicalName()));
    }
}
