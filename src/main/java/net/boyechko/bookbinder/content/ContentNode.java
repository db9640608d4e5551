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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.bookbinder.markup.AstNode;

/**
 * A node of a book's content tree, backed by a {@link MarkupDocument}. The parent reference is
 * used for navigation only; ownership runs from a {@link ContentContainer} to its children.
 */
public abstract class ContentNode {
    static final String TITLE = "title";
    static final String STATUS = "status";
    static final String DIGEST = "digest";

    private String name;
    private ContentContainer parent;
    private final MarkupDocument document;

    ContentNode(String name, ContentContainer parent, MarkupDocument document) {
        this.name = name;
        this.parent = parent;
        this.document = document;
    }

    public String name() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public ContentContainer parent() {
        return parent;
    }

    void setParent(ContentContainer parent) {
        this.parent = parent;
    }

    public MarkupDocument document() {
        return document;
    }

    public Map<String, Object> metadata() {
        return document.metadata();
    }

    public String content() {
        return document.content();
    }

    public String html() {
        return document.html();
    }

    public AstNode ast() {
        return document.ast();
    }

    /** Display title; defaults to the name. */
    public String title() {
        Object title = metadata().get(TITLE);
        if (title == null || title.toString().isBlank()) {
            return name;
        }
        return title.toString();
    }

    public void setTitle(String title) {
        if (title == null || title.isBlank() || title.strip().equals(name)) {
            metadata().remove(TITLE);
        } else {
            metadata().put(TITLE, title.strip());
        }
    }

    /** Slash-joined chain of names from the top-level item down to this node. */
    public String path() {
        if (parent == null || parent instanceof Book) {
            return name;
        }
        return parent.path() + "/" + name;
    }

    /** File or directory that holds this node. */
    public abstract Path location();

    /** File that holds this node's metadata and content. */
    public abstract Path backingFile();

    public abstract Status status();

    public boolean isText() {
        return this instanceof Text;
    }

    public boolean isSection() {
        return this instanceof Section;
    }

    public Book book() {
        ContentNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node instanceof Book b ? b : null;
    }

    /** Depth below the book; top-level items are at level 1. */
    public int level() {
        return parent == null ? 0 : parent.level() + 1;
    }

    /** One-based positions from the top-level item down to this node. */
    public List<Integer> ordinal() {
        if (parent == null) {
            return List.of();
        }
        List<Integer> result = new ArrayList<>(parent.ordinal());
        result.add(parent.indexOf(this) + 1);
        return Collections.unmodifiableList(result);
    }

    public String ordinalLabel() {
        return ordinal().stream().map(String::valueOf).collect(Collectors.joining("."));
    }

    /** Numbered heading such as "1.2.3. Title". */
    public String heading() {
        return ordinalLabel() + ". " + title();
    }

    /** Top-level ancestor, possibly this node itself. */
    public ContentNode chapter() {
        ContentNode node = this;
        while (node.parent != null && !(node.parent instanceof Book)) {
            node = node.parent;
        }
        return node;
    }

    public int wordCount() {
        String stripped = content().strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }

    public int characterCount() {
        return content().length();
    }

    public int sumWords() {
        return wordCount();
    }

    public int sumCharacters() {
        return characterCount();
    }

    /** Digest computed from the current state. */
    public String digest() {
        return DigestCalculator.digest(this);
    }

    /** Digest as last persisted in the metadata, or null. */
    public String storedDigest() {
        Object value = metadata().get(DIGEST);
        return value != null ? value.toString() : null;
    }

    /** This node followed by all descendants, depth first. */
    public List<ContentNode> subtree() {
        List<ContentNode> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(ContentNode node, List<ContentNode> result) {
        result.add(node);
        if (node instanceof ContentContainer container) {
            for (ContentNode child : container.children()) {
                collect(child, result);
            }
        }
    }

    /** Updates the derived metadata fields other than the digest. */
    void refreshDerived() {}

    /**
     * Recomputes derived fields and the digest and writes the backing file if anything changed.
     */
    public boolean write(boolean force) throws IOException {
        // the digest covers the content exactly as it is written
        document.update(document.content());
        String digest = digest();
        metadata().put(DIGEST, digest);
        return document.write(backingFile(), force);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + path() + "]";
    }
}
