package com.svformatter.util;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoggerUtilTest {
    @AfterEach
    void tearDown() {
        LoggerUtil.setConsoleLevel(Level.INFO);
    }

    @Test
    void getLogger_namesLoggerAfterClass() {
        Logger logger = LoggerUtil.getLogger(LoggerUtilTest.class);

        assertThat(logger.getName()).isEqualTo("com.svformatter.util.LoggerUtilTest");
    }

    @Test
    void bundledConfiguration_installsAConsoleHandler() {
        LoggerUtil.initialize();

        assertThat(LoggerUtil._consoleHandlers()).isNotEmpty();
    }

    @Test
    void consoleLevel_appliesToEveryConsoleHandler() {
        LoggerUtil.initialize();

        LoggerUtil.setConsoleLevel(Level.WARNING);
        for (Handler handler : LoggerUtil._consoleHandlers()) {
            assertThat(handler.getLevel()).isEqualTo(Level.WARNING);
        }

        LoggerUtil.setConsoleLevel(Level.FINE);
        for (Handler handler : LoggerUtil._consoleHandlers()) {
            assertThat(handler.getLevel()).isEqualTo(Level.FINE);
        }
        assertThat(Logger.getLogger(LoggerUtil.PROJECT_LOGGER).isLoggable(Level.FINE)).isTrue();
    }
}
