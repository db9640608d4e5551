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

/** Where collected footnote definitions are written. */
public enum FootnotePlacement {
    EACH_TEXT("each text"),
    EACH_CHAPTER("each chapter"),
    END_OF_BOOK("end of book");

    private final String label;

    FootnotePlacement(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FootnotePlacement fromLabel(String value) {
        return Labels.parse(FootnotePlacement.class, value, FootnotePlacement::label);
    }
}
