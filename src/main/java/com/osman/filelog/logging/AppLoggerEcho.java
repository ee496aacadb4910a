package com.osman.filelog.logging;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

final class AppLoggerEcho implements DiagnosticEcho {

    static final int BACKLOG_CAPACITY = 1024;

    // one daemon thread for every echo; lines beyond the backlog are discarded
    private static final ExecutorService EXECUTOR = createExecutor();

    static final AppLoggerEcho INSTANCE = new AppLoggerEcho(AppLogger.get());

    private final Logger logger;

    AppLoggerEcho(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void echo(String renderedLine) {
        if (!logger.isLoggable(Level.FINE)) {
            return;
        }
        EXECUTOR.execute(() -> publish(renderedLine));
    }

    private void publish(String renderedLine) {
        try {
            logger.log(Level.FINE, renderedLine);
        } catch (RuntimeException ignored) {
            // a failing console handler must not kill the echo thread
        }
    }

    private static ExecutorService createExecutor() {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "filelog-echo");
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(BACKLOG_CAPACITY), tf, new ThreadPoolExecutor.DiscardPolicy());
    }
}
