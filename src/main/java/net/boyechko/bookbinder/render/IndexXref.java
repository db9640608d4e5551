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

/** What an index entry shows for each occurrence of a term. */
public enum IndexXref {
    PAGE_NUMBER("page number"),
    FULL_PATH("full path"),
    HEADING("heading"),
    /** No index is written. */
    NONE("none");

    private final String label;

    IndexXref(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static IndexXref fromLabel(String value) {
        return Labels.parse(IndexXref.class, value, IndexXref::label);
    }
}
