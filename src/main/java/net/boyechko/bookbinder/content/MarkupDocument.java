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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import net.boyechko.bookbinder.markup.AstNode;
import net.boyechko.bookbinder.markup.MarkupParser;
import net.boyechko.bookbinder.markup.ParsedMarkup;

/**
 * Metadata plus markup content of one backing file, with the rendered markup and syntax tree
 * derived from the content. The derived forms are only ever recomputed from the content.
 */
public final class MarkupDocument {
    private final MarkupParser parser;
    private final Map<String, Object> metadata;
    private String content;
    private ParsedMarkup parsed;
    private String persisted; // file text as last read or written, null if never on disk

    public MarkupDocument(MarkupParser parser) {
        this(parser, new LinkedHashMap<>(), "");
    }

    public MarkupDocument(MarkupParser parser, Map<String, Object> metadata, String content) {
        this.parser = parser;
        this.metadata = metadata != null ? metadata : new LinkedHashMap<>();
        this.content = content != null ? content : "";
        this.parsed = parser.parse(this.content);
    }

    public static MarkupDocument read(Path file, MarkupParser parser) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        Frontmatter.Parts parts = Frontmatter.split(text);
        MarkupDocument document = new MarkupDocument(parser, parts.metadata(), parts.content());
        document.persisted = text;
        return document;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public String content() {
        return content;
    }

    public String html() {
        return parsed.html();
    }

    public AstNode ast() {
        return parsed.ast();
    }

    MarkupParser parser() {
        return parser;
    }

    /**
     * Replaces the content with its normalized form, reparsing if it changed. A null content is
     * ignored. Returns true if the content changed.
     */
    public boolean update(String newContent) {
        if (newContent == null) {
            return false;
        }
        String normalized = TextNormalizer.normalize(newContent);
        if (normalized.equals(content)) {
            return false;
        }
        content = normalized;
        parsed = parser.parse(content);
        return true;
    }

    public String serialize() {
        return Frontmatter.join(metadata, content);
    }

    /**
     * Writes the file when its serialized form differs from what is on disk, or when forced.
     * Callers normalize the content first. Returns true if the file was written.
     */
    public boolean write(Path file, boolean force) throws IOException {
        String text = serialize();
        if (!force && text.equals(persisted) && Files.exists(file)) {
            return false;
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, text, StandardCharsets.UTF_8);
        persisted = text;
        return true;
    }

    /** Takes over the state of a freshly read document. */
    void replaceWith(MarkupDocument fresh) {
        metadata.clear();
        metadata.putAll(fresh.metadata);
        content = fresh.content;
        parsed = fresh.parsed;
        persisted = fresh.persisted;
    }

    /** Deep copy with the same parser; the copy has never been persisted. */
    public MarkupDocument copy() {
        return new MarkupDocument(parser, Frontmatter.deepCopy(metadata), content);
    }
}
