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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.boyechko.bookbinder.catalog.CrossReferenceCatalog;
import net.boyechko.bookbinder.issues.IssueList;
import net.boyechko.bookbinder.markup.MarkupParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Root of a content tree, read from a directory. Owns the node graph, the path lookup table and
 * the cross-reference catalog. Not safe for concurrent mutation.
 */
public class Book extends ContentContainer {
    private static final Logger logger = LoggerFactory.getLogger(Book.class);

    static final String ITEMS = "items";
    static final String EXCLUDE = "exclude";
    private static final String NAME = "name";
    private static final String SUBTITLE = "subtitle";
    private static final String AUTHORS = "authors";
    private static final String LANGUAGE = "language";

    private final Path root;
    private final MarkupParser parser;
    private final Map<String, ContentNode> lookup = new LinkedHashMap<>();
    private CrossReferenceCatalog catalog = CrossReferenceCatalog.empty();

    private Book(Path root, MarkupParser parser, MarkupDocument document) {
        super(root.getFileName().toString(), null, document);
        this.root = root;
        this.parser = parser;
    }

    public static Book load(Path root) throws IOException {
        return load(root, MarkupParser.standard());
    }

    /** Reads the book in the given directory, its index record and all content below it. */
    public static Book load(Path root, MarkupParser parser) throws IOException {
        Path index = root.resolve(NameRules.INDEX_FILE);
        if (!Files.isRegularFile(index)) {
            throw new ContentNotFoundException("No book at " + root);
        }
        Book book = new Book(root, parser, MarkupDocument.read(index, parser));
        book.readItems();
        return book;
    }

    /** Discards the in-memory tree and reads everything again from disk. */
    public void reload() throws IOException {
        document().replaceWith(MarkupDocument.read(backingFile(), parser));
        readItems();
    }

    private void readItems() throws IOException {
        setChildren(List.of());
        lookup.clear();
        readChildren(this);
        for (ContentNode child : children()) {
            register(child);
        }

        List<Map<String, Object>> persisted = persistedOrder();
        applyOrder(this, persisted);
        if (!itemsOrder(this).equals(persisted)) {
            logger.info("Item order of {} changed on disk; rewriting index", id());
            write(false);
        }
        rebuildCatalog();
        logger.debug("Loaded book {} with {} items", id(), lookup.size());
    }

    private void readChildren(ContentContainer container) throws IOException {
        List<Path> entries;
        try (Stream<Path> listing = Files.list(container.directory())) {
            entries = listing.sorted().collect(Collectors.toList());
        }

        for (Path entry : entries) {
            String fileName = entry.getFileName().toString();
            if (NameRules.isIgnored(fileName)) {
                continue;
            }
            if (Files.isDirectory(entry)) {
                container.addChild(readSection(container, entry));
            } else if (fileName.endsWith(NameRules.EXTENSION)) {
                String name =
                        fileName.substring(0, fileName.length() - NameRules.EXTENSION.length());
                Text text = new Text(name, container, MarkupDocument.read(entry, parser));
                if (container == this && isExcluded(text)) {
                    logger.debug("Skipping excluded text {}", name);
                    continue;
                }
                container.addChild(text);
            }
        }
    }

    private Section readSection(ContentContainer parent, Path dir) throws IOException {
        Path index = dir.resolve(NameRules.INDEX_FILE);
        MarkupDocument document;
        if (Files.isRegularFile(index)) {
            document = MarkupDocument.read(index, parser);
        } else {
            logger.warn("Section {} has no index record; writing an empty one", dir);
            document = new MarkupDocument(parser);
            document.write(index, true);
        }
        Section section = new Section(dir.getFileName().toString(), parent, document);
        readChildren(section);
        return section;
    }

    private static boolean isExcluded(Text text) {
        return Boolean.TRUE.equals(text.metadata().get(EXCLUDE));
    }

    // ── Identity and metadata ─────────────────────────────────────────

    public String id() {
        return name();
    }

    @Override
    public String path() {
        return "";
    }

    @Override
    public Path location() {
        return root;
    }

    MarkupParser parser() {
        return parser;
    }

    public String subtitle() {
        Object value = metadata().get(SUBTITLE);
        return value != null ? value.toString() : null;
    }

    public List<String> authors() {
        Object value = metadata().get(AUTHORS);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return value != null ? List.of(value.toString()) : List.of();
    }

    public String language() {
        Object value = metadata().get(LANGUAGE);
        return value != null ? value.toString() : null;
    }

    /** Least finished status among the items, or the recorded status when there are none. */
    @Override
    public Status status() {
        if (isEmpty()) {
            return Status.parse(metadata().get(STATUS));
        }
        return Status.min(
                children().stream().map(ContentNode::status).collect(Collectors.toList()),
                Status.LOWEST);
    }

    // ── Lookup ────────────────────────────────────────────────────────

    /** All nodes below the book, depth first; the book itself is not included. */
    public List<ContentNode> allItems() {
        List<ContentNode> all = subtree();
        return all.subList(1, all.size());
    }

    public List<Text> allTexts() {
        return allItems().stream()
                .filter(ContentNode::isText)
                .map(Text.class::cast)
                .collect(Collectors.toList());
    }

    public Optional<ContentNode> find(String path) {
        return Optional.ofNullable(lookup.get(path));
    }

    public ContentNode get(String path) {
        ContentNode node = lookup.get(path);
        if (node == null) {
            throw new ContentNotFoundException("No such item in " + id() + ": " + path);
        }
        return node;
    }

    /** Read-only view of the path lookup table. */
    public Map<String, ContentNode> lookup() {
        return Collections.unmodifiableMap(lookup);
    }

    /** Adds the node and its descendants to the lookup table under their current paths. */
    void register(ContentNode node) {
        for (ContentNode n : node.subtree()) {
            ContentNode existing = lookup.putIfAbsent(n.path(), n);
            if (existing != null && existing != n) {
                throw new IllegalStateException("Duplicate path in lookup table: " + n.path());
            }
        }
    }

    /** Removes the node and its descendants from the lookup table. */
    void unregister(ContentNode node) {
        for (ContentNode n : node.subtree()) {
            lookup.remove(n.path());
        }
    }

    // ── Catalog ───────────────────────────────────────────────────────

    public CrossReferenceCatalog catalog() {
        return catalog;
    }

    public void rebuildCatalog() {
        catalog = CrossReferenceCatalog.build(this);
    }

    // ── Ordering ──────────────────────────────────────────────────────

    /** The item order as persisted in the index record. */
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> persistedOrder() {
        Object items = metadata().get(ITEMS);
        List<Map<String, Object>> result = new ArrayList<>();
        if (items instanceof List<?> list) {
            for (Object entry : list) {
                if (entry instanceof Map<?, ?> map) {
                    result.add((Map<String, Object>) map);
                }
            }
        }
        return result;
    }

    /**
     * Reorders the container's children to follow the entries, matched by name. Children not
     * mentioned keep their discovered order after the matched ones.
     */
    @SuppressWarnings("unchecked")
    private static void applyOrder(ContentContainer container, List<Map<String, Object>> order) {
        Map<String, ContentNode> remaining = new LinkedHashMap<>();
        for (ContentNode child : container.children()) {
            remaining.put(child.name(), child);
        }

        List<ContentNode> ordered = new ArrayList<>();
        for (Map<String, Object> entry : order) {
            ContentNode child = remaining.remove(String.valueOf(entry.get(NAME)));
            if (child == null) {
                continue;
            }
            ordered.add(child);
            if (child instanceof Section section && entry.get(ITEMS) instanceof List<?> nested) {
                List<Map<String, Object>> nestedOrder = new ArrayList<>();
                for (Object n : nested) {
                    if (n instanceof Map<?, ?> map) {
                        nestedOrder.add((Map<String, Object>) map);
                    }
                }
                applyOrder(section, nestedOrder);
            }
        }
        ordered.addAll(remaining.values());
        container.setChildren(ordered);
    }

    /** The current order as {@code {name, title, items}} entries. */
    static List<Map<String, Object>> itemsOrder(ContentContainer container) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (ContentNode child : container.children()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NAME, child.name());
            entry.put(TITLE, child.title());
            if (child instanceof Section section) {
                entry.put(ITEMS, itemsOrder(section));
            }
            result.add(entry);
        }
        return result;
    }

    @Override
    void refreshDerived() {
        super.refreshDerived();
        metadata().put(ITEMS, itemsOrder(this));
    }

    // ── Persistence and integrity ─────────────────────────────────────

    /** Writes the index records of every container on the chain from the node to the book. */
    void writeAncestors(ContentNode node) throws IOException {
        for (ContentContainer c = node.parent(); c != null; c = c.parent()) {
            c.write(false);
        }
    }

    public IssueList integrityIssues() {
        return IntegrityChecker.check(this);
    }

    /** Throws {@link IntegrityException} if the consistency check reports anything. */
    public void checkIntegrity() {
        IssueList issues = integrityIssues();
        if (!issues.isEmpty()) {
            throw new IntegrityException("Integrity check of " + id() + " failed", issues);
        }
    }
}
