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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.boyechko.bookbinder.markup.MarkupParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the books found under one root directory. Constructed and passed explicitly by the
 * application; {@link #refresh()} rereads everything.
 */
public class BookLibrary {
    private static final Logger logger = LoggerFactory.getLogger(BookLibrary.class);

    public static final String DIR_PROPERTY = "bookbinder.dir";
    public static final String DIR_ENV = "BOOKBINDER_DIR";
    public static final String DEFAULT_DIR = "books";
    public static final String REFERENCES = "references";

    private final Path root;
    private final MarkupParser parser;
    private final Map<String, Book> books = new TreeMap<>();

    public BookLibrary(Path root) {
        this(root, MarkupParser.standard());
    }

    public BookLibrary(Path root, MarkupParser parser) {
        this.root = root;
        this.parser = parser;
    }

    /**
     * Resolves the library root from the {@value #DIR_PROPERTY} system property, then the
     * {@value #DIR_ENV} environment variable, then {@value #DEFAULT_DIR} in the working directory.
     */
    public static Path resolveRootDir() {
        String configured = System.getProperty(DIR_PROPERTY);
        if (configured == null || configured.isBlank()) {
            configured = System.getenv(DIR_ENV);
        }
        if (configured == null || configured.isBlank()) {
            return Paths.get(DEFAULT_DIR).toAbsolutePath();
        }
        return Paths.get(configured).toAbsolutePath();
    }

    public Path root() {
        return root;
    }

    /** Rereads every book directory below the root. Unreadable books are logged and skipped. */
    public void refresh() throws IOException {
        books.clear();
        if (!Files.isDirectory(root)) {
            logger.warn("Library directory {} does not exist", root);
            return;
        }
        List<Path> dirs;
        try (Stream<Path> listing = Files.list(root)) {
            dirs =
                    listing.filter(Files::isDirectory)
                            .filter(d -> Files.isRegularFile(d.resolve(NameRules.INDEX_FILE)))
                            .sorted()
                            .collect(Collectors.toList());
        }
        for (Path dir : dirs) {
            String id = dir.getFileName().toString();
            if (NameRules.isIgnored(id)) {
                continue;
            }
            try {
                books.put(id, Book.load(dir, parser));
            } catch (IOException | RuntimeException e) {
                logger.error("Could not load book {}: {}", id, e.getMessage());
            }
        }
        logger.info("Library {} holds {} books", root, books.size());
    }

    public Book get(String id) {
        Book book = books.get(id);
        if (book == null) {
            throw new ContentNotFoundException("No such book: " + id);
        }
        return book;
    }

    public List<Book> books() {
        return Collections.unmodifiableList(new ArrayList<>(books.values()));
    }

    /** Directory holding the reference records shared by all books. */
    public Path referencesDir() {
        return root.resolve(REFERENCES);
    }
}
