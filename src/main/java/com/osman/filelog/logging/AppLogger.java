package com.osman.filelog.logging;

import com.osman.filelog.config.ConfigService;

import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The library's own console logger. Never writes to the log file, so failures of
 * {@link LogWriter} can be reported without recursing into it.
 */
public final class AppLogger {
    static final String LOGGER_NAME = "com.osman.filelog";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                return "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(ConfigService.getInstance().getConsoleLevel());
        return logger;
    }
}
