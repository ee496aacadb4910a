package com.osman.filelog.logging;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppLoggerEchoTest {

    @Test
    void republishesLinesAtFineLevelOffTheCallingThread() throws Exception {
        Logger logger = Logger.getLogger("com.osman.filelog.test.echo");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.FINE);
        CountDownLatch received = new CountDownLatch(1);
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        Handler capture = new CapturingHandler(records, threads, received);
        logger.addHandler(capture);
        try {
            new AppLoggerEcho(logger).echo("01/01/2026 00:00:00 Info    | {0} literal");

            assertTrue(received.await(5, TimeUnit.SECONDS), "echo not delivered");
            LogRecord record = records.get(0);
            assertEquals(Level.FINE, record.getLevel());
            assertEquals("01/01/2026 00:00:00 Info    | {0} literal", record.getMessage());
            assertEquals("filelog-echo", threads.get(0));
        } finally {
            logger.removeHandler(capture);
        }
    }

    @Test
    void skipsEchoWhenFineIsDisabledAndSurvivesHandlerFailures() throws Exception {
        Logger logger = Logger.getLogger("com.osman.filelog.test.echo-failing");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.FINE);
        CountDownLatch received = new CountDownLatch(1);
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler failing = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getMessage().equals("boom")) {
                    throw new IllegalStateException("handler down");
                }
                records.add(record);
                received.countDown();
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(failing);
        try {
            AppLoggerEcho echo = new AppLoggerEcho(logger);
            echo.echo("boom");
            echo.echo("after");
            assertTrue(received.await(5, TimeUnit.SECONDS), "echo thread stopped after a failure");
            assertEquals("after", records.get(0).getMessage());

            logger.setLevel(Level.INFO);
            echo.echo("ignored");
            assertEquals(1, records.size());
        } finally {
            logger.removeHandler(failing);
        }
    }

    @Test
    void dropsLinesBeyondBacklogWhileConsoleIsBlocked() throws Exception {
        Logger logger = Logger.getLogger("com.osman.filelog.test.echo-blocked");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.FINE);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch last = new CountDownLatch(1);
        List<String> delivered = new CopyOnWriteArrayList<>();
        Handler blocking = new Handler() {
            @Override
            public void publish(LogRecord record) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                delivered.add(record.getMessage());
                if (record.getMessage().equals("final")) {
                    last.countDown();
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(blocking);
        try {
            AppLoggerEcho echo = new AppLoggerEcho(logger);
            echo.echo("first");
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            int offered = AppLoggerEcho.BACKLOG_CAPACITY * 3;
            for (int i = 0; i < offered; i++) {
                echo.echo("line " + i);
            }
            release.countDown();
            // the backlog has drained once the final line gets a slot and arrives
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (last.getCount() > 0 && System.nanoTime() < deadline) {
                echo.echo("final");
                last.await(10, TimeUnit.MILLISECONDS);
            }
            assertEquals(0, last.getCount(), "echo thread did not recover");
            long lines = delivered.stream().filter(m -> m.startsWith("line ")).count();
            assertTrue(lines <= AppLoggerEcho.BACKLOG_CAPACITY, "backlog grew to " + lines);
        } finally {
            logger.removeHandler(blocking);
        }
    }

    private static final class CapturingHandler extends Handler {
        private final List<LogRecord> records;
        private final List<String> threads;
        private final CountDownLatch received;

        CapturingHandler(List<LogRecord> records, List<String> threads, CountDownLatch received) {
            this.records = records;
            this.threads = threads;
            this.received = received;
            setLevel(Level.ALL);
        }

        @Override
        public void publish(LogRecord record) {
            records.add(record);
            threads.add(Thread.currentThread().getName());
            received.countDown();
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
