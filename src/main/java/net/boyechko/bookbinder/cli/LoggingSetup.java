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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Points Logback at the console with a root level taken from the CLI verbosity. */
public final class LoggingSetup {

    static final String CONSOLE_APPENDER_NAME = "BOOKBINDER_CONSOLE";
    private static final String PATTERN = "%-24logger{0} [%-5level] %msg%n";

    private LoggingSetup() {}

    public static void configure(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
        ensureConsoleAppender(ctx, root);
    }

    private static void ensureConsoleAppender(
            LoggerContext ctx, ch.qos.logback.classic.Logger root) {
        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }
        // logback.xml ships its own console appender; replace it so lines are not doubled
        root.detachAndStopAllAppenders();

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern(PATTERN);
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setTarget("System.err");
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }
}
