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
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural and content mutations of a {@link Book}. Every operation validates before it touches
 * the disk or the tree, keeps the lookup table in step with the tree, and re-persists the index
 * records it affects.
 */
public class BookEditor {
    private static final Logger logger = LoggerFactory.getLogger(BookEditor.class);

    private static final String COPY_SUFFIX = "_copy";

    private final Book book;

    public BookEditor(Book book) {
        this.book = book;
    }

    public Book book() {
        return book;
    }

    // ── Create ────────────────────────────────────────────────────────

    public Text createText(ContentContainer parent, String name, String title)
            throws IOException {
        checkNewName(parent, name, null);

        Text text = new Text(name, parent, new MarkupDocument(book.parser()));
        text.setTitle(title);
        text.write(true);

        parent.addChild(text);
        book.register(text);
        book.writeAncestors(text);
        logger.info("Created text {}", text.path());
        return text;
    }

    public Section createSection(ContentContainer parent, String name, String title)
            throws IOException {
        checkNewName(parent, name, null);

        Section section = new Section(name, parent, new MarkupDocument(book.parser()));
        section.setTitle(title);
        Files.createDirectory(section.directory());
        section.write(true);

        parent.addChild(section);
        book.register(section);
        book.writeAncestors(section);
        logger.info("Created section {}", section.path());
        return section;
    }

    // ── Edit ──────────────────────────────────────────────────────────

    /**
     * Sets title and content; a null argument leaves that part unchanged. The catalog is rebuilt
     * when the content changed.
     */
    public void update(ContentNode node, String title, String content) throws IOException {
        if (title != null) {
            node.setTitle(title);
        }
        boolean contentChanged = node.document().update(content);
        node.write(false);
        book.writeAncestors(node);
        if (contentChanged) {
            book.rebuildCatalog();
        }
    }

    public void setStatus(Text text, Status status) throws IOException {
        text.setStatus(status);
        text.write(false);
        book.writeAncestors(text);
    }

    public void rename(ContentNode node, String newName) throws IOException {
        requireItem(node);
        if (newName != null && newName.equals(node.name())) {
            return;
        }
        checkNewName(node.parent(), newName, node);

        String oldPath = node.path();
        Files.move(node.location(), locationIn(node, node.parent(), newName));

        book.unregister(node);
        node.setName(newName);
        book.register(node);
        book.writeAncestors(node);
        logger.info("Renamed {} to {}", oldPath, node.path());
    }

    // ── Reorder ───────────────────────────────────────────────────────

    /** Moves the node one step toward the front; the first item wraps to the end. */
    public void moveEarlier(ContentNode node) throws IOException {
        requireItem(node);
        ContentContainer parent = node.parent();
        List<ContentNode> order = new ArrayList<>(parent.children());
        int index = parent.indexOf(node);
        order.remove(index);
        if (index == 0) {
            order.add(node);
        } else {
            order.add(index - 1, node);
        }
        parent.setChildren(order);
        book.write(false);
    }

    /** Moves the node one step toward the end; the last item wraps to the front. */
    public void moveLater(ContentNode node) throws IOException {
        requireItem(node);
        ContentContainer parent = node.parent();
        List<ContentNode> order = new ArrayList<>(parent.children());
        int index = parent.indexOf(node);
        order.remove(index);
        if (index == order.size()) {
            order.add(0, node);
        } else {
            order.add(index + 1, node);
        }
        parent.setChildren(order);
        book.write(false);
    }

    // ── Move between containers ───────────────────────────────────────

    /**
     * Moves the node out of its section, placing it right after that section. A top-level item
     * stays where it is. The book is reloaded afterwards, so callers must look nodes up again by
     * the returned path.
     */
    public String moveOutOf(ContentNode node) throws IOException {
        requireItem(node);
        ContentContainer parent = node.parent();
        if (parent == book) {
            return node.path();
        }
        book.checkIntegrity();
        ContentContainer grandparent = parent.parent();
        checkNoCollision(grandparent, node.name(), node);

        Files.move(node.location(), locationIn(node, grandparent, node.name()));

        book.unregister(node);
        parent.removeChild(node);
        grandparent.insertChild(grandparent.indexOf(parent) + 1, node);
        book.register(node);
        return finishMove(node, parent);
    }

    /**
     * Moves the node into the closest preceding sibling section, as its last child. The book is
     * reloaded afterwards, so callers must look nodes up again by the returned path.
     */
    public String moveInto(ContentNode node) throws IOException {
        requireItem(node);
        Section target = precedingSection(node);
        if (target == null) {
            throw new ContentValidationException("No section before " + node.path());
        }
        book.checkIntegrity();
        checkNoCollision(target, node.name(), node);

        Files.move(node.location(), locationIn(node, target, node.name()));

        ContentContainer oldParent = node.parent();
        book.unregister(node);
        oldParent.removeChild(node);
        target.addChild(node);
        book.register(node);
        return finishMove(node, oldParent);
    }

    private String finishMove(ContentNode node, ContentContainer oldParent) throws IOException {
        String newPath = node.path();
        if (oldParent != book) {
            oldParent.write(false);
            book.writeAncestors(oldParent);
        }
        book.writeAncestors(node);
        book.write(true);
        book.reload();
        logger.info("Moved item to {}", newPath);
        return newPath;
    }

    /** Closest section before the node among its siblings, or null. */
    public static Section precedingSection(ContentNode node) {
        ContentContainer parent = node.parent();
        for (int i = parent.indexOf(node) - 1; i >= 0; i--) {
            if (parent.children().get(i) instanceof Section section) {
                return section;
            }
        }
        return null;
    }

    // ── Delete and convert ────────────────────────────────────────────

    /** Deletes the node; a section with children requires {@code force}. */
    public void delete(ContentNode node, boolean force) throws IOException {
        requireItem(node);
        if (node instanceof Section section && !section.isEmpty() && !force) {
            throw new ContentValidationException("Section is not empty: " + node.path());
        }

        ContentContainer parent = node.parent();
        String path = node.path();
        if (node instanceof Section) {
            deleteTree(node.location());
        } else {
            Files.delete(node.location());
        }
        book.unregister(node);
        parent.removeChild(node);
        if (parent == book) {
            book.write(false);
        } else {
            parent.write(false);
            book.writeAncestors(parent);
        }
        book.rebuildCatalog();
        logger.info("Deleted {}", path);
    }

    /**
     * Turns a text into a section of the same name holding the text as its only child. The text
     * keeps its identity and metadata; its path gains one level.
     */
    public Section convertToSection(Text text) throws IOException {
        requireItem(text);
        ContentContainer parent = text.parent();
        Path directory = parent.directory().resolve(text.name());
        if (Files.exists(directory)) {
            throw new ContentValidationException("Directory already exists: " + directory);
        }

        Files.createDirectory(directory);
        try {
            Files.move(text.location(), directory.resolve(text.name() + NameRules.EXTENSION));
        } catch (IOException e) {
            try {
                Files.delete(directory);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        book.unregister(text);
        Section section = new Section(text.name(), parent, new MarkupDocument(book.parser()));
        section.setTitle(text.title());
        parent.replaceChild(text, section);
        section.addChild(text);
        section.write(true);
        book.register(section);
        book.writeAncestors(section);
        logger.info("Converted {} to a section", section.path());
        return section;
    }

    // ── Copy and search ───────────────────────────────────────────────

    /** Copies the node to the next free {@code name_copy[_N]} and places it after the original. */
    public ContentNode copy(ContentNode node) throws IOException {
        requireItem(node);
        ContentContainer parent = node.parent();

        String name = node.name() + COPY_SUFFIX;
        int number = 1;
        while (isTaken(parent, name)) {
            number++;
            name = node.name() + COPY_SUFFIX + "_" + number;
        }
        String suffix = number == 1 ? " (copy)" : " (copy " + number + ")";

        ContentNode copy;
        if (node instanceof Text text) {
            Text textCopy = new Text(name, parent, text.document().copy());
            textCopy.metadata().remove(ContentNode.DIGEST);
            copy = textCopy;
        } else {
            Path target = parent.directory().resolve(name);
            copyTree(node.location(), target);
            copy = readSectionCopy(parent, name, (Section) node);
        }
        copy.setTitle(node.title() + suffix);
        copy.write(true);

        parent.insertChild(parent.indexOf(node) + 1, copy);
        book.register(copy);
        book.writeAncestors(copy);
        book.rebuildCatalog();
        logger.info("Copied {} to {}", node.path(), copy.path());
        return copy;
    }

    private Section readSectionCopy(ContentContainer parent, String name, Section original)
            throws IOException {
        Path directory = parent.directory().resolve(name);
        Section copy =
                new Section(
                        name,
                        parent,
                        MarkupDocument.read(
                                directory.resolve(NameRules.INDEX_FILE), book.parser()));
        readCopiedChildren(copy, original);
        return copy;
    }

    /** Reads the copied files of a section in the order of the original's children. */
    private void readCopiedChildren(Section copy, Section original) throws IOException {
        for (ContentNode child : original.children()) {
            if (child instanceof Section originalChild) {
                Section sectionCopy =
                        new Section(
                                child.name(),
                                copy,
                                MarkupDocument.read(
                                        copy.directory()
                                                .resolve(child.name())
                                                .resolve(NameRules.INDEX_FILE),
                                        book.parser()));
                copy.addChild(sectionCopy);
                readCopiedChildren(sectionCopy, originalChild);
            } else {
                Path file = copy.directory().resolve(child.name() + NameRules.EXTENSION);
                copy.addChild(
                        new Text(child.name(), copy, MarkupDocument.read(file, book.parser())));
            }
        }
    }

    /** Nodes whose title or content contains the term, in depth-first order. */
    public List<ContentNode> search(String term, boolean ignoreCase) {
        List<ContentNode> result = new ArrayList<>();
        if (term == null || term.isEmpty()) {
            return result;
        }
        String needle = ignoreCase ? term.toLowerCase(Locale.ROOT) : term;
        for (ContentNode node : book.allItems()) {
            String title = ignoreCase ? node.title().toLowerCase(Locale.ROOT) : node.title();
            String content = ignoreCase ? node.content().toLowerCase(Locale.ROOT) : node.content();
            if (title.contains(needle) || content.contains(needle)) {
                result.add(node);
            }
        }
        return result;
    }

    // ── Validation helpers ────────────────────────────────────────────

    private void requireItem(ContentNode node) {
        if (node == null || node == book || book.lookup().get(node.path()) != node) {
            throw new ContentNotFoundException("Not an item of " + book.id() + ": " + node);
        }
    }

    /** Validates a new name for a child of the parent; {@code self} is ignored as a sibling. */
    private void checkNewName(ContentContainer parent, String name, ContentNode self) {
        NameRules.validate(name);
        checkNoCollision(parent, name, self);
    }

    private void checkNoCollision(ContentContainer parent, String name, ContentNode self) {
        for (ContentNode sibling : parent.children()) {
            if (sibling != self && sibling.name().equals(name)) {
                throw new ContentValidationException(
                        "Name already in use: " + name + " in " + describe(parent));
            }
        }
        // Blocks both name and name.md, whichever kind of node is being placed
        Path directory = parent.directory();
        if (Files.exists(directory.resolve(name))
                || Files.exists(directory.resolve(name + NameRules.EXTENSION))) {
            throw new ContentValidationException(
                    "File or directory already exists: " + name + " in " + describe(parent));
        }
    }

    /** Where the node's file or directory lives under the given parent and name. */
    private static Path locationIn(ContentNode node, ContentContainer parent, String name) {
        String fileName = node instanceof Text ? name + NameRules.EXTENSION : name;
        return parent.directory().resolve(fileName);
    }

    private static boolean isTaken(ContentContainer parent, String name) {
        return parent.child(name).isPresent()
                || Files.exists(parent.directory().resolve(name))
                || Files.exists(parent.directory().resolve(name + NameRules.EXTENSION));
    }

    private static String describe(ContentContainer container) {
        return container instanceof Book b ? "book " + b.id() : container.path();
    }

    private static void deleteTree(Path root) throws IOException {
        Files.walkFileTree(
                root,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                            throws IOException {
                        if (exc != null) {
                            throw exc;
                        }
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(
                source,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                            throws IOException {
                        Files.createDirectories(target.resolve(source.relativize(dir)));
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        Files.copy(
                                file,
                                target.resolve(source.relativize(file)),
                                StandardCopyOption.COPY_ATTRIBUTES);
                        return FileVisitResult.CONTINUE;
                    }
                });
    }
}
