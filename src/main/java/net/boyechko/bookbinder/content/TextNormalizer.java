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

/** Housekeeping applied to markup content on every write path. */
public final class TextNormalizer {

    private TextNormalizer() {}

    /**
     * Right-trims every line and collapses runs of blank lines to one. A null input yields null.
     */
    public static String normalize(String content) {
        if (content == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(content.length());
        boolean previousEmpty = false;
        boolean first = true;
        for (String line : content.split("\n", -1)) {
            String trimmed = line.stripTrailing();
            boolean empty = trimmed.isEmpty();
            if (empty && previousEmpty) {
                continue;
            }
            previousEmpty = empty;
            if (!first) {
                sb.append('\n');
            }
            sb.append(trimmed);
            first = false;
        }
        return sb.toString();
    }
}
