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
package net.boyechko.bookbinder.markup;

/** Closed set of markup node variants produced by a {@link MarkupParser}. */
public enum NodeKind {
    DOCUMENT,
    PARAGRAPH,
    RAW_TEXT,
    BLANK_LINE,
    LINE_BREAK,
    HEADING,
    QUOTE,
    CODE_SPAN,
    CODE_BLOCK,
    FENCED_CODE,
    EMPHASIS,
    STRONG_EMPHASIS,
    SUBSCRIPT,
    SUPERSCRIPT,
    EMDASH,
    THEMATIC_BREAK,
    LINK,
    IMAGE,
    LIST,
    LIST_ITEM,
    INDEXED,
    REFERENCE,
    FOOTNOTE_REF,
    FOOTNOTE_DEF,
    HTML,
    UNKNOWN
}
