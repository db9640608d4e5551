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

import java.util.Collection;
import java.util.Locale;

/** Writing status of a content node, ordered from least to most finished. */
public enum Status {
    STARTED,
    OUTLINE,
    INCOMPLETE,
    DRAFT,
    WRITTEN,
    REVISED,
    DONE,
    PROOFS,
    FINAL;

    /** Status given to nodes with nothing to aggregate. */
    public static final Status LOWEST = STARTED;

    /** Name as stored in frontmatter. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a frontmatter value; unknown or missing values yield {@link #LOWEST}. */
    public static Status parse(Object value) {
        if (value == null) {
            return LOWEST;
        }
        try {
            return valueOf(value.toString().strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOWEST;
        }
    }

    /** Returns the least finished status, or {@code fallback} when there is none. */
    public static Status min(Collection<Status> statuses, Status fallback) {
        return statuses.stream().min(Enum::compareTo).orElse(fallback);
    }
}
