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

import java.io.IOException;
import java.util.List;
import net.boyechko.bookbinder.BookTestBase;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.content.ContentNode;
import net.boyechko.bookbinder.markup.AstNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class FootnoteTableTest extends BookTestBase {

    private FootnoteTable table;
    private ContentNode intro;
    private ContentNode part;

    @BeforeEach
    void setUp() throws IOException {
        Book book = sampleBook();
        intro = book.get("intro");
        part = book.get("part");
        table = new FootnoteTable();
    }

    @Test
    void numbersFollowFirstReference() {
        assertEquals(1, table.reference(intro, "x"));
        assertEquals(2, table.reference(intro, "y"));
        assertEquals(1, table.reference(intro, "x"));
    }

    @Test
    void scopesNumberIndependently() {
        table.reference(intro, "a");
        table.reference(intro, "b");

        assertEquals(1, table.reference(part, "b"));
    }

    @Test
    void definitionMayPrecedeReference() {
        List<AstNode> body = List.of(AstNode.paragraph(AstNode.rawText("Later.")));
        table.define(intro, "late", body);
        table.reference(intro, "early");
        table.reference(intro, "late");

        List<FootnoteTable.Note> notes = table.take(intro);

        assertEquals(List.of("early", "late"), notes.stream().map(n -> n.label()).toList());
        assertNull(notes.get(0).body());
        assertEquals(body, notes.get(1).body());
        assertEquals(2, notes.get(1).number());
    }

    @Test
    void takeDropsUnreferencedAndClearsScope() {
        table.define(intro, "orphan", List.of());
        assertFalse(table.hasNotes(intro));

        table.reference(intro, "used");
        assertTrue(table.hasNotes(intro));

        assertEquals(1, table.take(intro).size());
        assertTrue(table.take(intro).isEmpty());
        assertFalse(table.hasNotes(intro));
        assertEquals(1, table.reference(intro, "again"));
    }
}
