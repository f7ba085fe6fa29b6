// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

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

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.tessera.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        TesseraDebug.setEnabled(false);
        logger.detachAppender(appender);
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.logStore("should not appear");
        DebugLogger.logAuth("nor this");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void channelsAreIndependent() {
        TesseraDebug.setAuthLogging(true);

        DebugLogger.logStore("store line");
        DebugLogger.logAuth("auth %s", "line");

        assertEquals(1, appender.list.size());
        assertEquals("auth line", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        TesseraDebug.setEnabled(true);
        DebugLogger.logStore("value=%s", "0x" + "ab".repeat(64));
        DebugLogger.logAuth("result=%s", "AUTHORIZED");

        assertEquals(2, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("(64 bytes)"));
    }
}
