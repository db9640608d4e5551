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

/**
 * Console verbosity, from least to most verbose.
 *
 * <ul>
 *   <li>QUIET - errors only
 *   <li>NORMAL - warnings and final status (default)
 *   <li>VERBOSE - progress of loading, rendering and writing
 *   <li>DEBUG - everything
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0, "ERROR"),
    NORMAL(1, "WARN"),
    VERBOSE(2, "INFO"),
    DEBUG(3, "DEBUG");

    private final int level;
    private final String logLevel;

    VerbosityLevel(int level, String logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    public int getLevel() {
        return level;
    }

    /** Name of the matching Logback level. */
    public String logLevel() {
        return logLevel;
    }

    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}
