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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfOutline;
import com.itextpdf.kernel.pdf.PdfReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.boyechko.bookbinder.BookTestBase;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.content.NameRules;
import net.boyechko.bookbinder.render.ReferenceLookup;
import net.boyechko.bookbinder.render.RenderEngine;
import net.boyechko.bookbinder.render.RenderResult;
import net.boyechko.bookbinder.render.RenderSettings;
import net.boyechko.bookbinder.render.StyleChange;
import net.boyechko.bookbinder.render.StyleSnapshot;
import net.boyechko.bookbinder.render.StyleSnapshot.Family;
import org.junit.jupiter.api.Test;

public class PdfDocumentSinkTest extends BookTestBase {

    @Test
    void rendersBookToPdfWithOutline() throws IOException {
        Book book = sampleBook();
        RenderEngine engine =
                new RenderEngine(
                        RenderSettings.forBook(book),
                        ReferenceLookup.empty(),
                        () -> PdfDocumentSink.forBook(book));

        RenderResult result = engine.render(book);

        byte[] bytes = result.output();
        assertEquals("%PDF-", new String(bytes, 0, 5, StandardCharsets.US_ASCII));
        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(bytes)))) {
            assertEquals(6, pdf.getNumberOfPages());
            assertEquals("Sample Book", pdf.getDocumentInfo().getTitle());
            assertTrue(pdf.isTagged());
            List<String> bookmarks =
                    pdf.getOutlines(false).getAllChildren().stream()
                            .map(PdfOutline::getTitle)
                            .toList();
            assertEquals(
                    List.of("1. Introduction", "2. First Part", "References", "Index"),
                    bookmarks);
        }
    }

    @Test
    void recordsBookLanguage() throws IOException {
        Path dir = bookDir("lang", "Sprache");
        writeMarkup(
                dir.resolve(NameRules.INDEX_FILE),
                meta("title", "Sprache", "language", "de-DE", "pdf", meta("contents_pages", 0)),
                "Ein [#Wort].\n");
        Book book = Book.load(dir);
        RenderEngine engine =
                new RenderEngine(
                        RenderSettings.forBook(book),
                        ReferenceLookup.empty(),
                        () -> PdfDocumentSink.forBook(book));

        byte[] bytes = engine.render(book).output();

        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(bytes)))) {
            assertEquals(
                    "de-DE",
                    pdf.getCatalog().getPdfObject().getAsString(PdfName.Lang).toUnicodeString());
            assertEquals(2, pdf.getNumberOfPages());
        }
    }

    @Test
    void retriesWithMoreContentsPagesWhenTheyOverflow() throws IOException {
        Path dir = bookDir("long", "Long Book");
        for (int i = 1; i <= 50; i++) {
            writeText(dir, String.format("t%02d", i), "Chapter " + i, "Words.\n");
        }
        Book book = Book.load(dir);
        AtomicInteger sinks = new AtomicInteger();
        RenderEngine engine =
                new RenderEngine(
                        RenderSettings.forBook(book),
                        ReferenceLookup.empty(),
                        () -> {
                            sinks.incrementAndGet();
                            return PdfDocumentSink.forBook(book);
                        });

        RenderResult result = engine.render(book);

        assertEquals(2, result.contentsPages());
        assertEquals(2, sinks.get());
        try (PdfDocument pdf =
                new PdfDocument(new PdfReader(new ByteArrayInputStream(result.output())))) {
            assertEquals(1 + 2 + 50, pdf.getNumberOfPages());
        }
    }

    @Test
    void choosesStandardFontVariant() {
        StyleSnapshot plain = StyleSnapshot.defaults(RenderSettings.defaults());

        assertEquals(StandardFonts.HELVETICA, PdfDocumentSink.fontName(plain));
        assertEquals(
                StandardFonts.TIMES_BOLDITALIC,
                PdfDocumentSink.fontName(
                        plain.apply(
                                StyleChange.none()
                                        .withFamily(Family.SERIF)
                                        .withBold(true)
                                        .withItalic(true))));
        assertEquals(
                StandardFonts.COURIER_OBLIQUE,
                PdfDocumentSink.fontName(
                        plain.apply(
                                StyleChange.none().withFamily(Family.MONO).withItalic(true))));
    }

    @Test
    void parsesHexColors() {
        DeviceRgb blue = PdfDocumentSink.color(StyleSnapshot.LINK_BLUE);

        assertArrayEquals(
                new float[] {0x1a / 255f, 0x0d / 255f, 0xab / 255f}, blue.getColorValue(), 1e-4f);
        assertThrows(IllegalArgumentException.class, () -> PdfDocumentSink.color("#fff"));
    }
}
