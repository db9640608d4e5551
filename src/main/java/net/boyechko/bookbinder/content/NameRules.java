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
package net.boyechko.bookbinder.content;

import java.io.File;

/** Validation of node names, which double as file and directory names. */
public final class NameRules {

    public static final String INDEX_FILE = "index.md";
    public static final String EXTENSION = ".md";
    public static final String LOCK_PREFIX = ".#";

    private NameRules() {}

    /** Throws {@link ContentValidationException} unless the name is usable on disk. */
    public static String validate(String name) {
        if (name == null || name.isBlank()) {
            throw new ContentValidationException("Name must not be empty");
        }
        String stripped = name.strip();
        if (!stripped.equals(name)) {
            throw new ContentValidationException("Name must not have surrounding whitespace");
        }
        if (name.contains("/") || name.contains(".")) {
            throw new ContentValidationException("Name contains disallowed character: " + name);
        }
        if (File.separatorChar != '/' && name.indexOf(File.separatorChar) >= 0) {
            throw new ContentValidationException("Name contains disallowed character: " + name);
        }
        if (name.indexOf('\\') >= 0 && isCaseInsensitivePlatform()) {
            throw new ContentValidationException("Name contains disallowed character: " + name);
        }
        if (name.equals("index")) {
            throw new ContentValidationException("Name is reserved: " + name);
        }
        return name;
    }

    /** True for directory entries that a scan must not treat as content. */
    public static boolean isIgnored(String fileName) {
        return fileName.startsWith(LOCK_PREFIX)
                || fileName.startsWith(".")
                || fileName.equals(INDEX_FILE);
    }

    private static boolean isCaseInsensitivePlatform() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.contains("win") || os.contains("mac");
    }
}
