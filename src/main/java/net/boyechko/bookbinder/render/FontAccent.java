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

/** Font accent applied to indexed terms and reference ids in the body. */
public enum FontAccent {
    NONE("none"),
    ITALIC("italic"),
    BOLD("bold"),
    UNDERLINE("underline");

    private final String label;

    FontAccent(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FontAccent fromLabel(String value) {
        return Labels.parse(FontAccent.class, value, FontAccent::label);
    }

    /** The style change that produces this accent. */
    public StyleChange toChange() {
        return switch (this) {
            case NONE -> StyleChange.none();
            case ITALIC -> StyleChange.none().withItalic(true);
            case BOLD -> StyleChange.none().withBold(true);
            case UNDERLINE -> StyleChange.none().withUnderline(true);
        };
    }
}
