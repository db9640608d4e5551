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

import net.boyechko.bookbinder.issues.IssueList;

/** Thrown when the consistency check of a book finds problems. */
public class IntegrityException extends RuntimeException {
    private final IssueList issues;

    public IntegrityException(String message, IssueList issues) {
        super(message + ": " + issues);
        this.issues = issues;
    }

    public IssueList getIssues() {
        return issues;
    }
}
