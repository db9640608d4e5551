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

/** Named paragraph style; list styles carry their nesting depth. */
public record ParagraphStyle(String name, int depth) {

    public static final ParagraphStyle NORMAL = new ParagraphStyle("Normal", 0);
    public static final ParagraphStyle TITLE = new ParagraphStyle("Title", 0);
    public static final ParagraphStyle SUBTITLE = new ParagraphStyle("Subtitle", 0);
    public static final ParagraphStyle QUOTE = new ParagraphStyle("Quote", 0);
    public static final ParagraphStyle CODE = new ParagraphStyle("Code", 0);
    public static final ParagraphStyle FOOTNOTE = new ParagraphStyle("Footnote", 0);
    public static final ParagraphStyle REFERENCE = new ParagraphStyle("Reference", 0);
    public static final ParagraphStyle INDEX_ENTRY = new ParagraphStyle("Index Entry", 0);

    public static ParagraphStyle heading(int level) {
        return new ParagraphStyle("Heading " + level, level);
    }

    public static ParagraphStyle listBullet(int depth) {
        return new ParagraphStyle("List Bullet " + depth, depth);
    }

    public static ParagraphStyle listNumber(int depth) {
        return new ParagraphStyle("List Number " + depth, depth);
    }

    public static ParagraphStyle listContinue(int depth) {
        return new ParagraphStyle("List Continue " + depth, depth);
    }

    public boolean isHeading() {
        return name.startsWith("Heading ");
    }

    public boolean isList() {
        return name.startsWith("List ");
    }

    @Override
    public String toString() {
        return name;
    }
}
