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

import net.boyechko.bookbinder.render.StyleSnapshot.Family;
import net.boyechko.bookbinder.render.StyleSnapshot.Vertical;

/**
 * A partial set of formatting attributes; null means "unchanged". Component order is the order in
 * which a sink must apply them: family, size, weight and slant, color, indents, vertical position.
 */
public record StyleChange(
        Family family,
        Double size,
        Boolean bold,
        Boolean italic,
        Boolean underline,
        String color,
        Vertical vertical,
        Double leftIndent,
        Double rightIndent,
        Double lineHeight) {

    private static final StyleChange NONE =
            new StyleChange(null, null, null, null, null, null, null, null, null, null);

    public static StyleChange none() {
        return NONE;
    }

    public boolean isEmpty() {
        return equals(NONE);
    }

    public StyleChange withFamily(Family value) {
        return new StyleChange(
                value, size, bold, italic, underline, color, vertical, leftIndent, rightIndent,
                lineHeight);
    }

    public StyleChange withSize(double value) {
        return new StyleChange(
                family, value, bold, italic, underline, color, vertical, leftIndent, rightIndent,
                lineHeight);
    }

    public StyleChange withBold(boolean value) {
        return new StyleChange(
                family, size, value, italic, underline, color, vertical, leftIndent, rightIndent,
                lineHeight);
    }

    public StyleChange withItalic(boolean value) {
        return new StyleChange(
                family, size, bold, value, underline, color, vertical, leftIndent, rightIndent,
                lineHeight);
    }

    public StyleChange withUnderline(boolean value) {
        return new StyleChange(
                family, size, bold, italic, value, color, vertical, leftIndent, rightIndent,
                lineHeight);
    }

    public StyleChange withColor(String value) {
        return new StyleChange(
                family, size, bold, italic, underline, value, vertical, leftIndent, rightIndent,
                lineHeight);
    }

    public StyleChange withVertical(Vertical value) {
        return new StyleChange(
                family, size, bold, italic, underline, color, value, leftIndent, rightIndent,
                lineHeight);
    }

    public StyleChange withLeftIndent(double value) {
        return new StyleChange(
                family, size, bold, italic, underline, color, vertical, value, rightIndent,
                lineHeight);
    }

    public StyleChange withRightIndent(double value) {
        return new StyleChange(
                family, size, bold, italic, underline, color, vertical, leftIndent, value,
                lineHeight);
    }
}
