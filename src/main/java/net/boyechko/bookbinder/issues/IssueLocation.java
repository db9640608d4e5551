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

/** Represents where in a book an {@link Issue} was found. */
public final class IssueLocation {
    private final String path; // content path, null if book-level
    private final Integer page; // output page, null if not rendering

    public IssueLocation() {
        this(null, null);
    }

    public IssueLocation(String path) {
        this(path, null);
    }

    public IssueLocation(String path, Integer page) {
        this.path = path;
        this.page = page;
    }

    public String path() {
        return path;
    }

    public Integer page() {
        return page;
    }

    @Override
    public String toString() {
        String output = "";
        if (path != null) {
            output += path;
        }
        if (page != null) {
            output += " (page " + page + ")";
        }
        return output.trim();
    }
}
