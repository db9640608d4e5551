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
package net.boyechko.bookbinder;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.content.ContentContainer;
import net.boyechko.bookbinder.content.Frontmatter;
import net.boyechko.bookbinder.content.NameRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that build small books on disk under a temporary library directory. */
public abstract class BookTestBase {

    @TempDir protected Path tempDir;
    protected String testMethodName;

    // ── Test lifecycle ──────────────────────────────────────────────

    @BeforeEach
    void captureTestName(TestInfo testInfo) {
        testMethodName = testInfo.getTestMethod().map(method -> method.getName()).orElse("test");
    }

    // ── Fixture writing ─────────────────────────────────────────────

    /** Library root holding the books of this test. */
    protected final Path libraryDir() throws IOException {
        return Files.createDirectories(tempDir.resolve("books"));
    }

    /** Creates a book directory with an index record and returns its path. */
    protected final Path bookDir(String id, String title) throws IOException {
        Path dir = Files.createDirectories(libraryDir().resolve(id));
        writeMarkup(dir.resolve(NameRules.INDEX_FILE), meta("title", title), "");
        return dir;
    }

    protected final Path writeText(Path dir, String name, String title, String content)
            throws IOException {
        return writeText(dir, name, meta("title", title), content);
    }

    protected final Path writeText(
            Path dir, String name, Map<String, Object> metadata, String content)
            throws IOException {
        Path file = dir.resolve(name + NameRules.EXTENSION);
        writeMarkup(file, metadata, content);
        return file;
    }

    protected final Path writeSection(Path dir, String name, String title) throws IOException {
        Path section = Files.createDirectories(dir.resolve(name));
        writeMarkup(section.resolve(NameRules.INDEX_FILE), meta("title", title), "");
        return section;
    }

    protected static void writeMarkup(Path file, Map<String, Object> metadata, String content)
            throws IOException {
        Files.writeString(file, Frontmatter.join(metadata, content));
    }

    /** Ordered metadata map from alternating keys and values. */
    protected static Map<String, Object> meta(Object... keysAndValues) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            result.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return result;
    }

    // ── Common books ────────────────────────────────────────────────

    /**
     * A book with two chapters: a text {@code intro} and a section {@code part} holding the texts
     * {@code one} and {@code two}.
     */
    protected final Book sampleBook() throws IOException {
        Path dir = bookDir("sample", "Sample Book");
        writeText(dir, "intro", "Introduction", "Opening words for the [#reader].\n");
        Path part = writeSection(dir, "part", "First Part");
        writeText(part, "one", "Chapter One", "Some text citing [@smith2020].\n");
        writeText(part, "two", "Chapter Two", "More about the [#Reader|reader] here.\n");
        writeMarkup(
                dir.resolve(NameRules.INDEX_FILE),
                meta(
                        "title",
                        "Sample Book",
                        "items",
                        List.of(
                                meta("name", "intro", "title", "Introduction"),
                                meta(
                                        "name",
                                        "part",
                                        "title",
                                        "First Part",
                                        "items",
                                        List.of(
                                                meta("name", "one", "title", "Chapter One"),
                                                meta("name", "two", "title", "Chapter Two"))))),
                "");
        return Book.load(dir);
    }

    protected static List<String> childNames(ContentContainer c) {
        return c.children().stream().map(n -> n.name()).toList();
    }

    // ── Diffs ───────────────────────────────────────────────────────

    protected static String unifiedDiff(String expected, String actual) {
        List<String> goalLines = expected.lines().toList();
        List<String> actualLines = actual.lines().toList();
        Patch<String> patch = DiffUtils.diff(goalLines, actualLines);
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff("goal", "actual", goalLines, patch, 2);
        return String.join("\n", diff);
    }
}
