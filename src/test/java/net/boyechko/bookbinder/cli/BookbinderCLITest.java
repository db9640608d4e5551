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
package net.boyechko.bookbinder.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.bookbinder.BookTestBase;
import net.boyechko.bookbinder.cli.BookbinderCLI.CLIConfig;
import net.boyechko.bookbinder.cli.BookbinderCLI.CLIException;
import net.boyechko.bookbinder.cli.BookbinderCLI.Command;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.content.BookEditor;
import net.boyechko.bookbinder.content.BookLibrary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BookbinderCLITest extends BookTestBase {

    private ByteArrayOutputStream captured;
    private PrintStream out;

    @BeforeEach
    void setUp() throws IOException {
        captured = new ByteArrayOutputStream();
        out = new PrintStream(captured, true, StandardCharsets.UTF_8);
        System.setProperty(BookLibrary.DIR_PROPERTY, libraryDir().toString());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(BookLibrary.DIR_PROPERTY);
    }

    // ── Argument parsing ────────────────────────────────────────────

    @Test
    void parsesCommandOptionsAndOperands() throws CLIException {
        CLIConfig config =
                BookbinderCLI.parseArguments(
                        new String[] {"-v", "render", "sample", "-o", "out.txt", "-t"});

        assertEquals(Command.RENDER, config.command());
        assertEquals(List.of("sample"), config.operands());
        assertEquals(Path.of("out.txt"), config.outputPath());
        assertTrue(config.transcript());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
    }

    @Test
    void parsesTwoOperandImport() throws CLIException {
        CLIConfig config =
                BookbinderCLI.parseArguments(
                        new String[] {"import-references", "refs.tgz", "refs", "-q"});

        assertEquals(Command.IMPORT_REFERENCES, config.command());
        assertEquals(List.of("refs.tgz", "refs"), config.operands());
        assertEquals(VerbosityLevel.QUIET, config.verbosity());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(CLIException.class, () -> BookbinderCLI.parseArguments(new String[] {}));
        assertThrows(
                CLIException.class, () -> BookbinderCLI.parseArguments(new String[] {"bind"}));
        assertThrows(
                CLIException.class, () -> BookbinderCLI.parseArguments(new String[] {"render"}));
        assertThrows(
                CLIException.class,
                () -> BookbinderCLI.parseArguments(new String[] {"list", "extra"}));
        assertThrows(
                CLIException.class,
                () -> BookbinderCLI.parseArguments(new String[] {"check", "x", "--fast"}));
        assertThrows(
                CLIException.class,
                () -> BookbinderCLI.parseArguments(new String[] {"render", "x", "-o"}));
    }

    // ── Commands ────────────────────────────────────────────────────

    @Test
    void helpPrintsUsage() {
        assertEquals(0, BookbinderCLI.run(new String[] {"--help"}, out));
        assertTrue(output().startsWith("Usage: bookbinder"));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, BookbinderCLI.run(new String[] {"bind"}, out));
    }

    @Test
    void listsLibraryBooks() throws IOException {
        sampleBook();

        assertEquals(0, BookbinderCLI.run(new String[] {"list"}, out));
        assertTrue(output().contains("sample"));
        assertTrue(output().contains("Sample Book"));
    }

    @Test
    void rendersTranscriptByLibraryId() throws IOException {
        sampleBook();
        Path outDir = Files.createDirectories(tempDir.resolve("out"));

        int status =
                BookbinderCLI.run(
                        new String[] {"render", "sample", "-t", "-o", outDir.toString()}, out);

        assertEquals(0, status);
        String transcript = Files.readString(outDir.resolve("sample.txt"));
        assertTrue(transcript.contains("¶ Title: *Sample Book*"));
        assertTrue(output().contains("UNKNOWN_REFERENCE"));
    }

    @Test
    void rendersPdfFromBookDirectory() throws IOException {
        Book book = sampleBook();
        Path target = tempDir.resolve("sample.pdf");

        int status =
                BookbinderCLI.run(
                        new String[] {
                            "render", book.location().toString(), "-o", target.toString()
                        },
                        out);

        assertEquals(0, status);
        byte[] bytes = Files.readAllBytes(target);
        assertEquals("%PDF-", new String(bytes, 0, 5, StandardCharsets.US_ASCII));
    }

    @Test
    void checkReportsIntegrity() throws IOException {
        Book book = sampleBook();

        assertEquals(0, BookbinderCLI.run(new String[] {"check", "sample"}, out));
        assertTrue(output().contains("no integrity issues"));

        new BookEditor(book).update(book.get("part/two"), null, "Recorded.\n");
        Path file = book.get("part/two").location();
        Files.writeString(file, Files.readString(file).replace("Recorded", "Edited"));

        assertEquals(1, BookbinderCLI.run(new String[] {"check", "sample"}, out));
        assertTrue(output().contains("DIGEST_MISMATCH"));
    }

    @Test
    void archivesBook() throws IOException {
        sampleBook();
        Path target = tempDir.resolve("sample.tgz");

        assertEquals(
                0,
                BookbinderCLI.run(
                        new String[] {"archive", "sample", "-o", target.toString()}, out));
        assertTrue(Files.size(target) > 0);
        assertTrue(output().contains("Archived 5 entries"));
    }

    @Test
    void unknownBookExitsWithOne() {
        assertEquals(1, BookbinderCLI.run(new String[] {"check", "missing"}, out));
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }
}
