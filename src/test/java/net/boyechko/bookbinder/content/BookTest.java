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
import java.util.Map;
import java.util.Set;
import net.boyechko.bookbinder.BookTestBase;
import org.junit.jupiter.api.Test;

public class BookTest extends BookTestBase {

    // ── Loading ─────────────────────────────────────────────────────

    @Test
    void loadsTreeInPersistedOrder() throws IOException {
        Book book = sampleBook();

        assertEquals("sample", book.id());
        assertEquals("Sample Book", book.title());
        assertEquals(List.of("intro", "part"), childNames(book));
        assertEquals(List.of("one", "two"), childNames((ContentContainer) book.get("part")));
        assertEquals(
                Set.of("intro", "part", "part/one", "part/two"), book.lookup().keySet());
    }

    @Test
    void persistedOrderOverridesDirectoryOrder() throws IOException {
        Path dir = bookDir("ordered", "Ordered");
        writeText(dir, "alpha", "Alpha", "");
        writeText(dir, "beta", "Beta", "");
        writeMarkup(
                dir.resolve(NameRules.INDEX_FILE),
                meta(
                        "title",
                        "Ordered",
                        "items",
                        List.of(
                                meta("name", "beta", "title", "Beta"),
                                meta("name", "alpha", "title", "Alpha"))),
                "");

        Book book = Book.load(dir);

        assertEquals(List.of("beta", "alpha"), childNames(book));
    }

    @Test
    void newFilesOnDiskAreAppendedAndIndexRewritten() throws IOException {
        Book book = sampleBook();
        writeText(book.location(), "appendix", "Appendix", "Late addition.\n");

        Book reloaded = Book.load(book.location());

        assertEquals(List.of("intro", "part", "appendix"), childNames(reloaded));
        Map<String, Object> index =
                Frontmatter.split(Files.readString(book.location().resolve(NameRules.INDEX_FILE)))
                        .metadata();
        List<?> items = (List<?>) index.get("items");
        assertEquals(3, items.size());
        assertEquals("appendix", ((Map<?, ?>) items.get(2)).get("name"));
    }

    @Test
    void missingIndexMeansNoBook() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("nothing"));

        assertThrows(ContentNotFoundException.class, () -> Book.load(dir));
    }

    @Test
    void sectionWithoutIndexGetsOneWritten() throws IOException {
        Path dir = bookDir("repair", "Repair");
        Path loose = Files.createDirectories(dir.resolve("loose"));
        writeText(loose, "inner", "Inner", "Text.\n");

        Book book = Book.load(dir);

        assertTrue(book.get("loose").isSection());
        assertTrue(Files.isRegularFile(loose.resolve(NameRules.INDEX_FILE)));
        assertTrue(book.find("loose/inner").isPresent());
    }

    @Test
    void skipsExcludedHiddenAndLockFiles() throws IOException {
        Path dir = bookDir("skips", "Skips");
        writeText(dir, "kept", "Kept", "");
        writeText(dir, "draft", meta("title", "Draft", "exclude", true), "");
        Files.writeString(dir.resolve(".#kept.md"), "lock");
        Files.writeString(dir.resolve(".notes.md"), "hidden");
        Files.writeString(dir.resolve("image.png"), "not markup");

        Book book = Book.load(dir);

        assertEquals(List.of("kept"), childNames(book));
    }

    // ── Navigation ──────────────────────────────────────────────────

    @Test
    void headingsAndChaptersFollowTheTree() throws IOException {
        Book book = sampleBook();
        ContentNode two = book.get("part/two");

        assertEquals("2.2. Chapter Two", two.heading());
        assertEquals(List.of(2, 2), two.ordinal());
        assertEquals(2, two.level());
        assertSame(book.get("part"), two.chapter());
        assertSame(book, two.book());
        assertEquals("1. Introduction", book.get("intro").heading());
    }

    @Test
    void unknownPathIsNotFound() throws IOException {
        Book book = sampleBook();

        assertTrue(book.find("part/three").isEmpty());
        assertThrows(ContentNotFoundException.class, () -> book.get("part/three"));
    }

    // ── Derived values ──────────────────────────────────────────────

    @Test
    void statusIsTheLeastFinishedText() throws IOException {
        Path dir = bookDir("statuses", "Statuses");
        writeText(dir, "a", meta("title", "A", "status", "final"), "");
        Path part = writeSection(dir, "part", "Part");
        writeText(part, "b", meta("title", "B", "status", "revised"), "");
        writeText(part, "c", meta("title", "C", "status", "draft"), "");

        Book book = Book.load(dir);

        assertEquals(Status.FINAL, book.get("a").status());
        assertEquals(Status.DRAFT, book.get("part").status());
        assertEquals(Status.DRAFT, book.status());
    }

    @Test
    void countsSumOverDescendants() throws IOException {
        Book book = sampleBook();

        assertEquals(5, book.get("intro").wordCount());
        assertEquals(9, book.get("part").sumWords());
        assertEquals(14, book.sumWords());
    }

    @Test
    void digestIsStableAndFollowsChildContent() throws IOException {
        Book book = sampleBook();
        String first = book.digest();

        assertEquals(first, book.digest());

        new BookEditor(book).update(book.get("part/one"), null, "Changed text.\n");

        assertNotEquals(first, book.digest());
    }
}
