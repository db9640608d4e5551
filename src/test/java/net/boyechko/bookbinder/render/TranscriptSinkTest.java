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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.bookbinder.render.StyleSnapshot.Family;
import net.boyechko.bookbinder.render.StyleSnapshot.Vertical;
import org.junit.jupiter.api.Test;

public class TranscriptSinkTest {

    private static final StyleSnapshot PLAIN = StyleSnapshot.defaults(RenderSettings.defaults());

    @Test
    void decoratesRunsByStyle() {
        StyleSnapshot boldItalic =
                PLAIN.apply(StyleChange.none().withBold(true).withItalic(true));
        StyleSnapshot monoSup =
                PLAIN.apply(
                        StyleChange.none()
                                .withFamily(Family.MONO)
                                .withVertical(Vertical.SUPERSCRIPT));

        assertEquals("*/x/*", TranscriptSink.decorate("x", boldItalic));
        assertEquals("^{`x`}", TranscriptSink.decorate("x", monoSup));
        assertEquals("  ", TranscriptSink.decorate("  ", boldItalic));
    }

    @Test
    void writesParagraphsPagesAndLinks() {
        TranscriptSink sink = new TranscriptSink();
        sink.beginPage();
        sink.beginParagraph(ParagraphStyle.heading(1));
        sink.writeRun("Title ", PLAIN);
        sink.insertPageBreak();
        sink.writeRun("one", PLAIN);
        sink.lineBreak();
        sink.addHyperlink("site", "https://example.org", PLAIN);
        sink.writeAnchoredRun("term", PLAIN, "idx-1");
        sink.horizontalRule();
        sink.addTable(List.of(List.of("a", "b")));

        String text = new String(sink.finish(), StandardCharsets.UTF_8);

        assertEquals(
                "=== page 1 ===\n"
                        + "¶ Heading 1: Title\n"
                        + "=== page 2 ===\n"
                        + "¶ Normal: one / [site](https://example.org)term{#idx-1}\n"
                        + "---\n"
                        + "| a | b |\n",
                text);
        assertEquals(text, sink.text());
        assertEquals(2, sink.currentPage());
    }

    @Test
    void insertsContentsRowsAtReservedPosition() {
        TranscriptSink sink = new TranscriptSink(2);
        sink.beginPage();
        sink.reserveContents(
                2,
                (target, outline) ->
                        target.addTable(
                                outline.stream()
                                        .map(e -> List.of(e.heading(), String.valueOf(e.page())))
                                        .toList()));
        sink.beginNamedSection("One", 1);
        sink.beginNamedSection("Two", 1);
        sink.beginNamedSection("Three", 1);

        String text = new String(sink.finish(), StandardCharsets.UTF_8);

        assertEquals(
                "=== page 1 ===\n"
                        + "| One | 3 |\n"
                        + "| Two | 3 |\n"
                        + "=== page 2 ===\n"
                        + "| Three | 3 |\n"
                        + "=== page 3 ===\n",
                text);
        assertEquals(3, sink.outline().size());
        assertEquals("sec-2", sink.outline().get(1).anchor());
    }

    @Test
    void overflowingContentsThrow() {
        TranscriptSink sink = new TranscriptSink(1);
        sink.beginPage();
        sink.reserveContents(
                1, (target, outline) -> target.addTable(List.of(List.of("a"), List.of("b"))));

        ContentsOverflowException e =
                assertThrows(ContentsOverflowException.class, sink::finish);
        assertEquals(1, e.getReservedPages());
    }
}
