// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.sift.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        SiftDebug.setIndexLogging(false);
        SiftDebug.setFilterLogging(false);
        logger.detachAppender(appender);
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.logIndex("should not appear");
        DebugLogger.logFilter("nor this");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void togglesAreIndependent() {
        SiftDebug.setFilterLogging(true);

        DebugLogger.logIndex("index event");
        DebugLogger.logFilter("filter event %d", 7);

        assertEquals(1, appender.list.size());
        assertEquals("filter event 7", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void truncatesOversizedMessages() {
        SiftDebug.setIndexLogging(true);

        DebugLogger.logIndex("x".repeat(5000));

        String logged = appender.list.get(0).getFormattedMessage();
        assertEquals(LogSanitizer.MAX_LOG_LENGTH, logged.length());
        assertTrue(logged.endsWith(LogSanitizer.TRUNCATION_SUFFIX));
    }
}
