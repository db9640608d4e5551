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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.content.BookArchive;
import net.boyechko.bookbinder.content.BookLibrary;
import net.boyechko.bookbinder.content.ContentNotFoundException;
import net.boyechko.bookbinder.content.ContentValidationException;
import net.boyechko.bookbinder.content.NameRules;
import net.boyechko.bookbinder.issues.IssueList;
import net.boyechko.bookbinder.issues.IssueType;
import net.boyechko.bookbinder.render.DocumentSink;
import net.boyechko.bookbinder.render.ReferenceLibrary;
import net.boyechko.bookbinder.render.ReferenceLookup;
import net.boyechko.bookbinder.render.RenderEngine;
import net.boyechko.bookbinder.render.RenderResult;
import net.boyechko.bookbinder.render.RenderSettings;
import net.boyechko.bookbinder.render.TranscriptSink;
import net.boyechko.bookbinder.render.pdf.PdfDocumentSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BookbinderCLI {

    private static Logger logger;

    public enum Command {
        LIST("list"),
        RENDER("render"),
        CHECK("check"),
        ARCHIVE("archive"),
        IMPORT_REFERENCES("import-references");

        private final String word;

        Command(String word) {
            this.word = word;
        }

        static Command fromWord(String word) throws CLIException {
            for (Command command : values()) {
                if (command.word.equals(word)) {
                    return command;
                }
            }
            throw new CLIException("Unknown command: " + word + "\n" + usageMessage());
        }
    }

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Command command,
            List<String> operands,
            Path outputPath,
            Path referencesDir,
            boolean transcript,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (command == null) {
                throw new IllegalArgumentException("Command is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            operands = List.copyOf(operands);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and checks operand counts. */
    static class CLIConfigBuilder {
        Command command;
        List<String> operands = new ArrayList<>();
        Path outputPath;
        Path referencesDir;
        boolean transcript;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (command == null) {
                throw new CLIException("No command specified\n" + usageMessage());
            }
            int expected =
                    switch (command) {
                        case LIST -> 0;
                        case RENDER, CHECK, ARCHIVE -> 1;
                        case IMPORT_REFERENCES -> 2;
                    };
            if (operands.size() != expected) {
                throw new CLIException(
                        command.word
                                + " expects "
                                + expected
                                + " argument(s), got "
                                + operands.size()
                                + "\n"
                                + usageMessage());
            }
            return new CLIConfig(
                    command, operands, outputPath, referencesDir, transcript, verbosity);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /** Runs one command and returns the process exit status. */
    static int run(String[] args, PrintStream out) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            LoggingSetup.configure(config.verbosity());
            logger().info("Running {} with verbosity {}", config.command(), config.verbosity());
            return execute(config, out);
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        } catch (ContentNotFoundException | ContentValidationException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("✗ I/O failure: " + e.getMessage());
            logger().debug("I/O failure", e);
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No command specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-o", "--output" -> {
                    if (i + 1 < args.length) {
                        b.outputPath = Paths.get(args[++i]);
                    } else {
                        throw new CLIException("Output path not specified after -o");
                    }
                }
                case "-r", "--references" -> {
                    if (i + 1 < args.length) {
                        b.referencesDir = Paths.get(args[++i]);
                    } else {
                        throw new CLIException("Directory not specified after -r");
                    }
                }
                case "-t", "--transcript" -> b.transcript = true;
                case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new CLIException("Unknown option: " + args[i]);
                    } else if (b.command == null) {
                        b.command = Command.fromWord(args[i]);
                    } else {
                        b.operands.add(args[i]);
                    }
                }
            }
        }

        return b.build();
    }

    private static int execute(CLIConfig config, PrintStream out) throws IOException {
        return switch (config.command()) {
            case LIST -> listBooks(out);
            case RENDER -> renderBook(config, out);
            case CHECK -> checkBook(config, out);
            case ARCHIVE -> archiveBook(config, out);
            case IMPORT_REFERENCES -> importReferences(config, out);
        };
    }

    // ── Commands ──────────────────────────────────────────────────────

    private static int listBooks(PrintStream out) throws IOException {
        BookLibrary library = new BookLibrary(BookLibrary.resolveRootDir());
        library.refresh();
        if (library.books().isEmpty()) {
            out.println("No books in " + library.root());
            return 0;
        }
        for (Book book : library.books()) {
            out.printf(
                    "%-24s %-10s %7d words  %s%n",
                    book.id(), book.status().label(), book.sumWords(), book.title());
        }
        return 0;
    }

    private static int renderBook(CLIConfig config, PrintStream out) throws IOException {
        Book book = resolveBook(config.operands().get(0));
        ReferenceLookup references = loadReferences(config, book);
        RenderSettings settings = RenderSettings.forBook(book);

        RenderEngine engine =
                new RenderEngine(
                        settings,
                        references,
                        () -> config.transcript() ? new TranscriptSink() : sinkFor(book));
        RenderResult result = engine.render(book);

        String extension = config.transcript() ? ".txt" : ".pdf";
        Path outputPath =
                config.outputPath() != null
                        ? config.outputPath()
                        : Paths.get(book.id() + extension);
        if (Files.isDirectory(outputPath)) {
            outputPath = outputPath.resolve(book.id() + extension);
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(outputPath, result.output());

        printIssues(result.issues(), out);
        out.println("✓ Output saved to " + outputPath);
        return 0;
    }

    private static DocumentSink sinkFor(Book book) {
        return PdfDocumentSink.forBook(book);
    }

    private static int checkBook(CLIConfig config, PrintStream out) throws IOException {
        Book book = resolveBook(config.operands().get(0));
        IssueList issues = book.integrityIssues();
        if (issues.isEmpty()) {
            out.println("✓ " + book.id() + ": no integrity issues");
            return 0;
        }
        printIssues(issues, out);
        return 1;
    }

    private static int archiveBook(CLIConfig config, PrintStream out) throws IOException {
        Book book = resolveBook(config.operands().get(0));
        Path outputPath =
                config.outputPath() != null ? config.outputPath() : Paths.get(book.id() + ".tgz");
        int entries;
        try (OutputStream stream = Files.newOutputStream(outputPath)) {
            entries = BookArchive.export(book, stream);
        }
        out.println("✓ Archived " + entries + " entries to " + outputPath);
        return 0;
    }

    private static int importReferences(CLIConfig config, PrintStream out) throws IOException {
        Path archive = Paths.get(config.operands().get(0));
        Path target = Paths.get(config.operands().get(1));
        if (!Files.isRegularFile(archive)) {
            throw new ContentNotFoundException("Archive not found: " + archive);
        }
        Files.createDirectories(target);
        int imported;
        try (InputStream stream = Files.newInputStream(archive)) {
            imported = BookArchive.importReferences(stream, target);
        }
        out.println("✓ Imported " + imported + " references into " + target);
        return 0;
    }

    // ── Helpers ───────────────────────────────────────────────────────

    /** A directory holding an index record is loaded directly; anything else is a library id. */
    static Book resolveBook(String argument) throws IOException {
        Path dir = Paths.get(argument);
        if (Files.isRegularFile(dir.resolve(NameRules.INDEX_FILE))) {
            return Book.load(dir.toAbsolutePath());
        }
        BookLibrary library = new BookLibrary(BookLibrary.resolveRootDir());
        library.refresh();
        return library.get(argument);
    }

    private static ReferenceLookup loadReferences(CLIConfig config, Book book)
            throws IOException {
        Path dir = config.referencesDir();
        if (dir == null) {
            Path libraryRoot = book.location().getParent();
            dir = libraryRoot != null ? libraryRoot.resolve(BookLibrary.REFERENCES) : null;
        }
        if (dir == null || !Files.isDirectory(dir)) {
            logger().info("No references directory; cited ids will be listed without details");
            return ReferenceLookup.empty();
        }
        return ReferenceLibrary.load(dir);
    }

    private static void printIssues(IssueList issues, PrintStream out) {
        for (Map.Entry<IssueType, IssueList> group : issues.groupByType().entrySet()) {
            out.println("✗ " + group.getValue().size() + " " + group.getKey().groupLabel());
            group.getValue().forEach(issue -> out.println("    " + issue));
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(BookbinderCLI.class);
        }
        return logger;
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: bookbinder [-q|-v|-vv] <command> [options] <arguments>\n"
                + "Commands:\n"
                + "  list                                  List the books in the library\n"
                + "  render <book> [-o out] [-r refs] [-t] Render a book to PDF\n"
                + "  check <book>                          Check a book's integrity\n"
                + "  archive <book> [-o out.tgz]           Export a book as a tar.gz archive\n"
                + "  import-references <archive> <dir>     Import reference records\n"
                + "Options:\n"
                + "  -h, --help        Show this help message\n"
                + "  -o, --output      Output file or directory\n"
                + "  -r, --references  Directory of reference records\n"
                + "  -t, --transcript  Render a plain-text transcript instead of a PDF\n"
                + "  -q, --quiet       Only show errors\n"
                + "  -v, --verbose     Show progress information\n"
                + "  -vv, --debug      Show all debug information\n"
                + "A <book> is a directory with an index.md, or the id of a book in the library\n"
                + "(-Dbookbinder.dir, $BOOKBINDER_DIR, or ./books).";
    }
}
