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
package net.boyechko.bookbinder.render;

/** Thrown when the table of contents needs more pages than were reserved for it. */
public class ContentsOverflowException extends RuntimeException {
    private final int reservedPages;

    public ContentsOverflowException(int reservedPages, String message) {
        super(message);
        this.reservedPages = reservedPages;
    }

    public int getReservedPages() {
        return reservedPages;
    }
}
