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
package net.boyechko.bookbinder.issues;

/** Represents the type of a problem found while checking or rendering a book. */
public enum IssueType {
    // Integrity issues
    LOOKUP_MISSING_ENTRY("nodes missing from the lookup table"),
    LOOKUP_ORPHAN_ENTRY("lookup entries without a tree node"),
    PATH_MISMATCH("paths inconsistent with the parent chain"),
    MISSING_BACKING_FILE("nodes without a backing file"),
    DIGEST_MISMATCH("texts with a stale digest"),

    // Rendering degeneracies
    UNKNOWN_NODE("unhandled markup nodes"),
    UNKNOWN_REFERENCE("cited references missing from the library"),
    UNDEFINED_FOOTNOTE("footnotes without a definition"),
    CONTENTS_OMITTED("table of contents omitted");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
