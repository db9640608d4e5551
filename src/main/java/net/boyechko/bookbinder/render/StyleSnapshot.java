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

import java.util.Objects;

/** Complete set of formatting attributes in effect at one point of the output. */
public record StyleSnapshot(
        Family family,
        double size,
        boolean bold,
        boolean italic,
        boolean underline,
        String color,
        Vertical vertical,
        double leftIndent,
        double rightIndent,
        double lineHeight) {

    public enum Family {
        SANS,
        SERIF,
        MONO
    }

    public enum Vertical {
        BASELINE,
        SUPERSCRIPT,
        SUBSCRIPT
    }

    public static final String BLACK = "#000000";
    public static final String LINK_BLUE = "#1a0dab";

    public StyleSnapshot {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(vertical, "vertical");
    }

    public static StyleSnapshot defaults(RenderSettings settings) {
        return new StyleSnapshot(
                Family.SANS,
                settings.fontSize(),
                false,
                false,
                false,
                BLACK,
                Vertical.BASELINE,
                0,
                0,
                settings.lineHeight());
    }

    /** New snapshot with the non-null attributes of the change applied. */
    public StyleSnapshot apply(StyleChange change) {
        return new StyleSnapshot(
                change.family() != null ? change.family() : family,
                change.size() != null ? change.size() : size,
                change.bold() != null ? change.bold() : bold,
                change.italic() != null ? change.italic() : italic,
                change.underline() != null ? change.underline() : underline,
                change.color() != null ? change.color() : color,
                change.vertical() != null ? change.vertical() : vertical,
                change.leftIndent() != null ? change.leftIndent() : leftIndent,
                change.rightIndent() != null ? change.rightIndent() : rightIndent,
                change.lineHeight() != null ? change.lineHeight() : lineHeight);
    }

    /** The attributes that must change to get from this snapshot to the target. */
    public StyleChange diff(StyleSnapshot target) {
        return new StyleChange(
                family != target.family ? target.family : null,
                size != target.size ? target.size : null,
                bold != target.bold ? target.bold : null,
                italic != target.italic ? target.italic : null,
                underline != target.underline ? target.underline : null,
                !color.equals(target.color) ? target.color : null,
                vertical != target.vertical ? target.vertical : null,
                leftIndent != target.leftIndent ? target.leftIndent : null,
                rightIndent != target.rightIndent ? target.rightIndent : null,
                lineHeight != target.lineHeight ? target.lineHeight : null);
    }
}
