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
package net.boyechko.bookbinder.render.pdf;

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfOutline;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.PdfViewerPreferences;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.action.PdfAction;
import com.itextpdf.kernel.pdf.canvas.draw.SolidLine;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.element.AreaBreak;
import com.itextpdf.layout.element.Link;
import com.itextpdf.layout.element.LineSeparator;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.element.Text;
import com.itextpdf.layout.layout.LayoutArea;
import com.itextpdf.layout.properties.AreaBreakType;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.UnitValue;
import com.itextpdf.layout.properties.VerticalAlignment;
import com.itextpdf.layout.renderer.DocumentRenderer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.render.ContentsOverflowException;
import net.boyechko.bookbinder.render.ContentsWriter;
import net.boyechko.bookbinder.render.DocumentSink;
import net.boyechko.bookbinder.render.OutlineEntry;
import net.boyechko.bookbinder.render.ParagraphStyle;
import net.boyechko.bookbinder.render.StyleChange;
import net.boyechko.bookbinder.render.StyleSnapshot;
import net.boyechko.bookbinder.render.StyleSnapshot.Vertical;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tagged A4 PDF written with the iText layout API, using the standard Type 1 fonts. Named
 * sections become bookmarks; the table of contents is drawn onto its reserved pages when the
 * document is finished.
 */
public class PdfDocumentSink implements DocumentSink {
    private static final Logger logger = LoggerFactory.getLogger(PdfDocumentSink.class);

    private static final float MARGIN = 54;
    private static final float CONTENTS_FONT_SIZE = 11;
    private static final float CONTENTS_LEADING = CONTENTS_FONT_SIZE * 1.5f;
    private static final float HEADING_SPACE = 12;
    private static final float TITLE_SPACE = 180;
    private static final float SUPERSCRIPT_RISE = 0.35f;
    private static final float SUBSCRIPT_RISE = -0.2f;
    private static final float SCRIPT_SCALE = 0.7f;

    // regular, italic, bold, bold italic
    private static final String[] SANS_FONTS = {
        StandardFonts.HELVETICA,
        StandardFonts.HELVETICA_OBLIQUE,
        StandardFonts.HELVETICA_BOLD,
        StandardFonts.HELVETICA_BOLDOBLIQUE
    };
    private static final String[] SERIF_FONTS = {
        StandardFonts.TIMES_ROMAN,
        StandardFonts.TIMES_ITALIC,
        StandardFonts.TIMES_BOLD,
        StandardFonts.TIMES_BOLDITALIC
    };
    private static final String[] MONO_FONTS = {
        StandardFonts.COURIER,
        StandardFonts.COURIER_OBLIQUE,
        StandardFonts.COURIER_BOLD,
        StandardFonts.COURIER_BOLDOBLIQUE
    };

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final PdfDocument pdf;
    private final Document document;
    private final DocumentRenderer renderer;
    private final Map<String, PdfFont> fonts = new HashMap<>();
    private final List<OutlineEntry> outline = new ArrayList<>();

    private Paragraph paragraph;
    private String pendingAnchor;
    private StyleSnapshot effective;

    private ContentsWriter contentsWriter;
    private int contentsFirstPage;
    private int contentsPages;
    private List<List<String>> contentsRows;

    public PdfDocumentSink(String title, String language) {
        this.pdf = new PdfDocument(new PdfWriter(output));
        pdf.setTagged();
        if (title != null) {
            pdf.getDocumentInfo().setTitle(title);
            pdf.getCatalog()
                    .setViewerPreferences(new PdfViewerPreferences().setDisplayDocTitle(true));
        }
        if (language != null && !language.isBlank()) {
            pdf.getCatalog().put(PdfName.Lang, new PdfString(language));
        }
        pdf.getDocumentInfo().setCreator("Bookbinder");
        this.document = new Document(pdf, PageSize.A4, false);
        this.renderer = new DocumentRenderer(document, false);
        document.setRenderer(renderer);
        document.setMargins(MARGIN, MARGIN, MARGIN, MARGIN);
    }

    public static PdfDocumentSink forBook(Book book) {
        return new PdfDocumentSink(book.title(), book.language());
    }

    @Override
    public void beginPage() {
        logger.debug("Starting PDF document");
    }

    @Override
    public void reserveContents(int pages, ContentsWriter writer) {
        flushParagraph();
        contentsWriter = writer;
        contentsPages = pages;
        document.add(new Paragraph(""));
        contentsFirstPage = currentPage();
        for (int i = 0; i < pages; i++) {
            document.add(new AreaBreak(AreaBreakType.NEXT_PAGE));
        }
    }

    @Override
    public void beginParagraph(ParagraphStyle style) {
        flushParagraph();
        paragraph = new Paragraph();
        if (effective != null) {
            paragraph.setMarginLeft((float) effective.leftIndent());
            paragraph.setMarginRight((float) effective.rightIndent());
            paragraph.setMultipliedLeading((float) effective.lineHeight());
        }
        if (style.isHeading()) {
            paragraph.setMarginTop(HEADING_SPACE).setKeepWithNext(true);
        } else if (style.equals(ParagraphStyle.TITLE)) {
            paragraph.setMarginTop(TITLE_SPACE).setTextAlignment(TextAlignment.CENTER);
        } else if (style.equals(ParagraphStyle.SUBTITLE)) {
            paragraph.setTextAlignment(TextAlignment.CENTER);
        }
        if (pendingAnchor != null) {
            paragraph.setDestination(pendingAnchor);
            pendingAnchor = null;
        }
    }

    @Override
    public void applyStyle(StyleChange change, StyleSnapshot effective) {
        this.effective = effective;
    }

    @Override
    public void writeRun(String text, StyleSnapshot style) {
        ensureParagraph().add(styled(new Text(text), style));
    }

    @Override
    public void writeAnchoredRun(String text, StyleSnapshot style, String anchor) {
        Text run = styled(new Text(text), style);
        run.setDestination(anchor);
        ensureParagraph().add(run);
    }

    @Override
    public void insertPageBreak() {
        flushParagraph();
        document.add(new AreaBreak(AreaBreakType.NEXT_PAGE));
    }

    @Override
    public String beginNamedSection(String heading, int level) {
        flushParagraph();
        String anchor = "sec-" + (outline.size() + 1);
        outline.add(new OutlineEntry(heading, level, currentPage(), anchor));
        pendingAnchor = anchor;
        return anchor;
    }

    @Override
    public void addHyperlink(String text, String url, StyleSnapshot style) {
        ensureParagraph().add(styled(new Link(text, PdfAction.createURI(url)), style));
    }

    @Override
    public void addInternalLink(String text, String anchor, StyleSnapshot style) {
        ensureParagraph().add(styled(new Link(text, PdfAction.createGoTo(anchor)), style));
    }

    @Override
    public void addTable(List<List<String>> rows) {
        if (contentsRows != null) {
            contentsRows.addAll(rows);
            return;
        }
        flushParagraph();
        int columns = rows.stream().mapToInt(List::size).max().orElse(1);
        Table table = new Table(UnitValue.createPercentArray(columns)).useAllAvailableWidth();
        for (List<String> row : rows) {
            for (int i = 0; i < columns; i++) {
                table.addCell(i < row.size() ? row.get(i) : "");
            }
        }
        document.add(table);
    }

    @Override
    public void horizontalRule() {
        flushParagraph();
        document.add(new LineSeparator(new SolidLine(0.5f)));
    }

    @Override
    public void lineBreak() {
        ensureParagraph().add(new Text("\n"));
    }

    @Override
    public int currentPage() {
        LayoutArea area = renderer.getCurrentArea();
        if (area != null) {
            return area.getPageNumber();
        }
        return Math.max(1, pdf.getNumberOfPages());
    }

    @Override
    public byte[] finish() {
        flushParagraph();
        if (contentsWriter != null) {
            writeContents();
        }
        writeOutline();
        document.close();
        logger.debug("Finished PDF with {} bytes", output.size());
        return output.toByteArray();
    }

    @Override
    public void discard() {
        if (!pdf.isClosed()) {
            document.close();
        }
        logger.debug("Discarded unfinished PDF");
    }

    // ── Contents and outline ──────────────────────────────────────────

    private void writeContents() {
        contentsRows = new ArrayList<>();
        contentsWriter.write(this, List.copyOf(outline));
        List<List<String>> rows = contentsRows;
        contentsRows = null;

        float top = PageSize.A4.getHeight() - MARGIN;
        float right = PageSize.A4.getWidth() - MARGIN;
        int rowsPerPage = (int) ((PageSize.A4.getHeight() - 2 * MARGIN) / CONTENTS_LEADING);
        int capacity = rowsPerPage * contentsPages;
        if (rows.size() > capacity) {
            throw new ContentsOverflowException(
                    contentsPages,
                    rows.size() + " contents rows exceed " + capacity + " available lines");
        }

        PdfFont font = font(StandardFonts.HELVETICA);
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            int page = contentsFirstPage + i / rowsPerPage;
            float y = top - (i % rowsPerPage) * CONTENTS_LEADING;
            if (!row.isEmpty()) {
                document.showTextAligned(
                        new Paragraph(row.get(0)).setFont(font).setFontSize(CONTENTS_FONT_SIZE),
                        MARGIN,
                        y,
                        page,
                        TextAlignment.LEFT,
                        VerticalAlignment.TOP,
                        0);
            }
            if (row.size() > 1 && !row.get(1).isEmpty()) {
                document.showTextAligned(
                        new Paragraph(row.get(1)).setFont(font).setFontSize(CONTENTS_FONT_SIZE),
                        right,
                        y,
                        page,
                        TextAlignment.RIGHT,
                        VerticalAlignment.TOP,
                        0);
            }
        }
    }

    private void writeOutline() {
        PdfOutline root = pdf.getOutlines(false);
        List<PdfOutline> parents = new ArrayList<>();
        for (OutlineEntry entry : outline) {
            int depth = Math.max(1, entry.level());
            while (parents.size() >= depth) {
                parents.remove(parents.size() - 1);
            }
            PdfOutline parent = parents.isEmpty() ? root : parents.get(parents.size() - 1);
            PdfOutline item = parent.addOutline(entry.heading());
            item.addAction(PdfAction.createGoTo(entry.anchor()));
            parents.add(item);
        }
    }

    // ── Runs ──────────────────────────────────────────────────────────

    private Paragraph ensureParagraph() {
        if (paragraph == null) {
            beginParagraph(ParagraphStyle.NORMAL);
        }
        return paragraph;
    }

    private void flushParagraph() {
        if (paragraph != null) {
            document.add(paragraph);
            paragraph = null;
        }
    }

    private <T extends Text> T styled(T run, StyleSnapshot style) {
        float size = (float) style.size();
        if (style.vertical() == Vertical.SUPERSCRIPT) {
            run.setTextRise(size * SUPERSCRIPT_RISE);
            size *= SCRIPT_SCALE;
        } else if (style.vertical() == Vertical.SUBSCRIPT) {
            run.setTextRise(size * SUBSCRIPT_RISE);
            size *= SCRIPT_SCALE;
        }
        run.setFont(font(fontName(style)));
        run.setFontSize(size);
        run.setFontColor(color(style.color()));
        if (style.underline()) {
            run.setUnderline();
        }
        return run;
    }

    static String fontName(StyleSnapshot style) {
        String[] variants =
                switch (style.family()) {
                    case SANS -> SANS_FONTS;
                    case SERIF -> SERIF_FONTS;
                    case MONO -> MONO_FONTS;
                };
        return variants[(style.bold() ? 2 : 0) + (style.italic() ? 1 : 0)];
    }

    private PdfFont font(String name) {
        return fonts.computeIfAbsent(
                name,
                n -> {
                    try {
                        return PdfFontFactory.createFont(n);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Cannot load standard font " + n, e);
                    }
                });
    }

    static DeviceRgb color(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            throw new IllegalArgumentException("Not an RGB color: " + hex);
        }
        return new DeviceRgb(
                Integer.parseInt(digits.substring(0, 2), 16),
                Integer.parseInt(digits.substring(2, 4), 16),
                Integer.parseInt(digits.substring(4, 6), 16));
    }
}
