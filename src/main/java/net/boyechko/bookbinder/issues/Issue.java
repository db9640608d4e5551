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

/** Represents a problem found while checking or rendering a book. */
public final class Issue {
    private final IssueType type;
    private final IssueSeverity severity;
    private final IssueLocation where;
    private final String message;

    public Issue(IssueType type, IssueSeverity severity, String message) {
        this(type, severity, new IssueLocation(), message);
    }

    public Issue(IssueType type, IssueSeverity severity, IssueLocation where, String message) {
        this.type = type;
        this.severity = severity;
        this.where = where;
        this.message = message;
    }

    public IssueType type() {
        return type;
    }

    public IssueSeverity severity() {
        return severity;
    }

    public IssueLocation where() {
        return where;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        String location = where.toString();
        return type + ": " + message + (location.isEmpty() ? "" : " [" + location + "]");
    }
}
