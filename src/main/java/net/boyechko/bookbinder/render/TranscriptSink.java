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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.bookbinder.render.StyleSnapshot.Family;
import net.boyechko.bookbinder.render.StyleSnapshot.Vertical;

/**
 * Plain-text sink that writes one line per paragraph with inline formatting markers. Pages only
 * advance on explicit breaks, and each contents page holds a fixed number of rows.
 *
 * <p>Markers: {@code `mono`}, {@code _underline_}, {@code /italic/}, {@code *bold*}, {@code
 * ^{sup}}, {@code ~{sub}}, {@code [text](url)} for links and {@code {#anchor}} after anchored runs.
 */
public class TranscriptSink implements DocumentSink {
    public static final int DEFAULT_ROWS_PER_PAGE = 40;

    private final int rowsPerPage;
    private final List<String> lines = new ArrayList<>();
    private final List<OutlineEntry> outline = new ArrayList<>();
    private final List<StyleChange> styleChanges = new ArrayList<>();
    private StringBuilder paragraph;
    private int page;

    private ContentsWriter contentsWriter;
    private int contentsIndex;
    private int contentsFirstPage;
    private int contentsPages;
    private List<String> contentsLines;

    private String text;

    public TranscriptSink() {
        this(DEFAULT_ROWS_PER_PAGE);
    }

    public TranscriptSink(int rowsPerPage) {
        if (rowsPerPage < 1) {
            throw new IllegalArgumentException("rowsPerPage must be positive");
        }
        this.rowsPerPage = rowsPerPage;
    }

    @Override
    public void beginPage() {
        page = 1;
        lines.add(pageMarker(page));
    }

    @Override
    public void reserveContents(int pages, ContentsWriter writer) {
        flush();
        contentsWriter = writer;
        contentsIndex = lines.size();
        contentsFirstPage = page;
        contentsPages = pages;
        page += pages;
        lines.add(pageMarker(page));
    }

    @Override
    public void beginParagraph(ParagraphStyle style) {
        flush();
        paragraph = new StringBuilder("¶ ").append(style.name()).append(": ");
    }

    @Override
    public void applyStyle(StyleChange change, StyleSnapshot effective) {
        styleChanges.add(change);
    }

    @Override
    public void writeRun(String text, StyleSnapshot style) {
        ensureParagraph().append(decorate(text, style));
    }

    @Override
    public void writeAnchoredRun(String text, StyleSnapshot style, String anchor) {
        ensureParagraph().append(decorate(text, style)).append("{#").append(anchor).append('}');
    }

    @Override
    public void insertPageBreak() {
        flush();
        page++;
        lines.add(pageMarker(page));
    }

    @Override
    public String beginNamedSection(String heading, int level) {
        String anchor = "sec-" + (outline.size() + 1);
        outline.add(new OutlineEntry(heading, level, page, anchor));
        return anchor;
    }

    @Override
    public void addHyperlink(String text, String url, StyleSnapshot style) {
        ensureParagraph().append('[').append(text).append("](").append(url).append(')');
    }

    @Override
    public void addInternalLink(String text, String anchor, StyleSnapshot style) {
        ensureParagraph().append('[').append(text).append("](#").append(anchor).append(')');
    }

    @Override
    public void addTable(List<List<String>> rows) {
        flush();
        List<String> target = contentsLines != null ? contentsLines : lines;
        for (List<String> row : rows) {
            target.add("| " + String.join(" | ", row) + " |");
        }
    }

    @Override
    public void horizontalRule() {
        flush();
        lines.add("---");
    }

    @Override
    public void lineBreak() {
        ensureParagraph().append(" / ");
    }

    @Override
    public int currentPage() {
        return page;
    }

    @Override
    public byte[] finish() {
        flush();
        if (contentsWriter != null) {
            contentsLines = new ArrayList<>();
            contentsWriter.write(this, Collections.unmodifiableList(outline));
            int capacity = contentsPages * rowsPerPage;
            if (contentsLines.size() > capacity) {
                throw new ContentsOverflowException(
                        contentsPages,
                        contentsLines.size() + " contents rows exceed " + capacity);
            }
            List<String> placed = new ArrayList<>();
            for (int i = 0; i < contentsLines.size(); i++) {
                if (i > 0 && i % rowsPerPage == 0) {
                    placed.add(pageMarker(contentsFirstPage + i / rowsPerPage));
                }
                placed.add(contentsLines.get(i));
            }
            lines.addAll(contentsIndex, placed);
            contentsLines = null;
        }
        text = String.join("\n", lines) + "\n";
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /** The finished transcript, or null before {@link #finish()}. */
    public String text() {
        return text;
    }

    public List<OutlineEntry> outline() {
        return Collections.unmodifiableList(outline);
    }

    /** Every change handed to {@link #applyStyle}, in order. */
    public List<StyleChange> styleChanges() {
        return Collections.unmodifiableList(styleChanges);
    }

    private StringBuilder ensureParagraph() {
        if (paragraph == null) {
            beginParagraph(ParagraphStyle.NORMAL);
        }
        return paragraph;
    }

    private void flush() {
        if (paragraph != null) {
            lines.add(paragraph.toString().stripTrailing());
            paragraph = null;
        }
    }

    private static String pageMarker(int page) {
        return "=== page " + page + " ===";
    }

    static String decorate(String text, StyleSnapshot style) {
        if (text.isBlank()) {
            return text;
        }
        String result = text;
        if (style.family() == Family.MONO) {
            result = "`" + result + "`";
        }
        if (style.underline()) {
            result = "_" + result + "_";
        }
        if (style.italic()) {
            result = "/" + result + "/";
        }
        if (style.bold()) {
            result = "*" + result + "*";
        }
        if (style.vertical() == Vertical.SUPERSCRIPT) {
            result = "^{" + result + "}";
        } else if (style.vertical() == Vertical.SUBSCRIPT) {
            result = "~{" + result + "}";
        }
        return result;
    }
}
