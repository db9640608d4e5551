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
package net.boyechko.bookbinder.content;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.bookbinder.BookTestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class BookLibraryTest extends BookTestBase {

    @AfterEach
    void clearProperty() {
        System.clearProperty(BookLibrary.DIR_PROPERTY);
    }

    @Test
    void findsBookDirectoriesWithIndex() throws IOException {
        sampleBook();
        bookDir("another", "Another");
        Files.createDirectories(libraryDir().resolve("references"));
        Files.createDirectories(libraryDir().resolve("stray"));

        BookLibrary library = new BookLibrary(libraryDir());
        library.refresh();

        assertEquals(
                List.of("another", "sample"), library.books().stream().map(Book::id).toList());
        assertEquals("Sample Book", library.get("sample").title());
        assertEquals(libraryDir().resolve("references"), library.referencesDir());
    }

    @Test
    void unknownIdIsNotFound() throws IOException {
        BookLibrary library = new BookLibrary(libraryDir());
        library.refresh();

        assertThrows(ContentNotFoundException.class, () -> library.get("missing"));
    }

    @Test
    void refreshPicksUpNewBooks() throws IOException {
        BookLibrary library = new BookLibrary(libraryDir());
        library.refresh();
        assertTrue(library.books().isEmpty());

        bookDir("late", "Late");
        library.refresh();

        assertEquals(1, library.books().size());
    }

    @Test
    void missingRootYieldsEmptyLibrary() throws IOException {
        BookLibrary library = new BookLibrary(tempDir.resolve("absent"));
        library.refresh();

        assertTrue(library.books().isEmpty());
    }

    @Test
    void systemPropertyChoosesRoot() {
        Path root = tempDir.resolve("configured");
        System.setProperty(BookLibrary.DIR_PROPERTY, root.toString());

        assertEquals(root.toAbsolutePath(), BookLibrary.resolveRootDir());
    }
}
