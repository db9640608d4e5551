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

import java.util.List;

/**
 * Output document backend driven by the {@link RenderEngine}. Implementations own all
 * format-specific concerns; the engine talks to them only through these primitives.
 */
public interface DocumentSink {

    /** Starts the first page. */
    void beginPage();

    /**
     * Reserves pages for the table of contents at the current position, leaving a fresh page
     * started after them. The writer is called from {@link #finish()}.
     */
    void reserveContents(int pages, ContentsWriter writer);

    void beginParagraph(ParagraphStyle style);

    /** Applies only the changed attributes; {@code effective} is the resulting full state. */
    void applyStyle(StyleChange change, StyleSnapshot effective);

    void writeRun(String text, StyleSnapshot style);

    /** Writes a run that internal links can point to under the given anchor name. */
    void writeAnchoredRun(String text, StyleSnapshot style, String anchor);

    void insertPageBreak();

    /**
     * Registers a named section at the current position for the outline and contents. Returns its
     * anchor name.
     */
    String beginNamedSection(String heading, int level);

    void addHyperlink(String text, String url, StyleSnapshot style);

    void addInternalLink(String text, String anchor, StyleSnapshot style);

    void addTable(List<List<String>> rows);

    void horizontalRule();

    void lineBreak();

    /** One-based number of the page that content written now lands on. */
    int currentPage();

    /**
     * Completes the document and returns its bytes.
     *
     * @throws ContentsOverflowException if the contents do not fit the reserved pages
     */
    byte[] finish();

    /** Releases the resources of a document that will not be finished. */
    default void discard() {}
}
