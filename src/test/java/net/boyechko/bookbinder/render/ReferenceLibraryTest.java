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
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.bookbinder.BookTestBase;
import org.junit.jupiter.api.Test;

public class ReferenceLibraryTest extends BookTestBase {

    @Test
    void readsOneRecordPerMarkupFile() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("references"));
        writeText(dir, "smith2020", meta("type", "article", "year", 2020), "");
        writeText(dir, "renamed", meta("id", "jones2019", "type", "book"), "");
        Files.writeString(dir.resolve("notes.txt"), "not a reference");

        ReferenceLibrary library = ReferenceLibrary.load(dir);

        assertEquals(2, library.all().size());
        assertEquals("article", library.find("smith2020").orElseThrow().type());
        assertEquals("2020", library.find("smith2020").orElseThrow().field("year").orElseThrow());
        assertTrue(library.find("jones2019").isPresent());
        assertTrue(library.find("renamed").isEmpty());
    }

    @Test
    void missingDirectoryIsEmpty() throws IOException {
        ReferenceLibrary library = ReferenceLibrary.load(tempDir.resolve("absent"));

        assertTrue(library.all().isEmpty());
        assertTrue(ReferenceLookup.empty().find("anything").isEmpty());
    }
}
