/*
 * Bookbinder - Markdown book authoring and PDF rendering
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.bookbinder.cli;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.slf4j.LoggerFactory;

public class LoggingSetupTest {

    private Logger root;
    private Level savedLevel;
    private final List<Appender<ILoggingEvent>> savedAppenders = new ArrayList<>();

    @BeforeEach
    void saveRootLogger() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        savedLevel = root.getLevel();
        for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext(); ) {
            savedAppenders.add(it.next());
        }
    }

    @AfterEach
    void restoreRootLogger() {
        Appender<ILoggingEvent> console = root.getAppender(LoggingSetup.CONSOLE_APPENDER_NAME);
        if (console != null) {
            root.detachAppender(console);
            console.stop();
        }
        for (Appender<ILoggingEvent> appender : savedAppenders) {
            appender.start();
            root.addAppender(appender);
        }
        root.setLevel(savedLevel);
    }

    @ParameterizedTest
    @EnumSource(VerbosityLevel.class)
    void rootLevelFollowsVerbosity(VerbosityLevel verbosity) {
        LoggingSetup.configure(verbosity);

        assertEquals(Level.toLevel(verbosity.logLevel()), root.getLevel());
    }

    @Test
    void installsConsoleAppenderOnce() {
        LoggingSetup.configure(VerbosityLevel.NORMAL);
        LoggingSetup.configure(VerbosityLevel.DEBUG);

        int count = 0;
        for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext(); ) {
            it.next();
            count++;
        }
        assertEquals(1, count);
        assertNotNull(root.getAppender(LoggingSetup.CONSOLE_APPENDER_NAME));
        assertEquals(Level.DEBUG, root.getLevel());
    }

    @Test
    void verbosityLevelsAreOrdered() {
        assertTrue(VerbosityLevel.DEBUG.isAtLeast(VerbosityLevel.VERBOSE));
        assertTrue(VerbosityLevel.NORMAL.isAtLeast(VerbosityLevel.NORMAL));
        assertFalse(VerbosityLevel.QUIET.isAtLeast(VerbosityLevel.NORMAL));
    }
}
