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
package net.boyechko.bookbinder.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.content.ContentNode;
import net.boyechko.bookbinder.markup.AstNode;
import net.boyechko.bookbinder.markup.AstVisitor;
import net.boyechko.bookbinder.markup.AstWalker;
import net.boyechko.bookbinder.markup.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indexed-term and reference-id catalogs of a book, built by walking the syntax tree of the book
 * and every node in it. The catalog is never patched; it is rebuilt from scratch.
 */
public final class CrossReferenceCatalog {
    private static final Logger logger = LoggerFactory.getLogger(CrossReferenceCatalog.class);

    /** Frontmatter key holding extra index keys for a node. */
    public static final String KEYWORDS = "keywords";

    private final Map<String, Set<ContentNode>> indexed = new TreeMap<>();
    private final Map<String, Set<ContentNode>> references = new TreeMap<>();

    private CrossReferenceCatalog() {}

    public static CrossReferenceCatalog empty() {
        return new CrossReferenceCatalog();
    }

    public static CrossReferenceCatalog build(Book book) {
        CrossReferenceCatalog catalog = new CrossReferenceCatalog();
        for (ContentNode node : book.subtree()) {
            catalog.scan(node);
        }
        logger.debug(
                "Catalog for {}: {} indexed keys, {} references",
                book.id(),
                catalog.indexed.size(),
                catalog.references.size());
        return catalog;
    }

    private void scan(ContentNode node) {
        new AstWalker().addVisitor(new CollectingVisitor(node)).walk(node.ast());

        Object keywords = node.metadata().get(KEYWORDS);
        if (keywords instanceof List<?> list) {
            for (Object keyword : list) {
                addIndexed(String.valueOf(keyword), node);
            }
        } else if (keywords != null) {
            addIndexed(keywords.toString(), node);
        }
    }

    private void addIndexed(String key, ContentNode node) {
        String trimmed = key.strip();
        if (!trimmed.isEmpty()) {
            indexed.computeIfAbsent(trimmed, k -> new LinkedHashSet<>()).add(node);
        }
    }

    private void addReference(String id, ContentNode node) {
        references.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(node);
    }

    public Map<String, Set<ContentNode>> indexed() {
        return Collections.unmodifiableMap(indexed);
    }

    public Map<String, Set<ContentNode>> references() {
        return Collections.unmodifiableMap(references);
    }

    public Set<ContentNode> nodesIndexedAs(String key) {
        return Collections.unmodifiableSet(indexed.getOrDefault(key, Set.of()));
    }

    public Set<ContentNode> nodesCiting(String referenceId) {
        return Collections.unmodifiableSet(references.getOrDefault(referenceId, Set.of()));
    }

    /** Both catalogs with nodes replaced by their sorted paths, for comparison. */
    public Map<String, Map<String, List<String>>> snapshot() {
        Map<String, Map<String, List<String>>> result = new TreeMap<>();
        result.put("indexed", pathsOf(indexed));
        result.put("references", pathsOf(references));
        return result;
    }

    private static Map<String, List<String>> pathsOf(Map<String, Set<ContentNode>> catalog) {
        Map<String, List<String>> result = new TreeMap<>();
        catalog.forEach(
                (key, nodes) -> {
                    List<String> paths = new ArrayList<>();
                    for (ContentNode node : nodes) {
                        paths.add(node.path());
                    }
                    Collections.sort(paths);
                    result.put(key, paths);
                });
        return result;
    }

    private final class CollectingVisitor implements AstVisitor {
        private final ContentNode owner;

        CollectingVisitor(ContentNode owner) {
            this.owner = owner;
        }

        @Override
        public String name() {
            return "Cross-reference collector";
        }

        @Override
        public boolean enterNode(AstNode node, int depth) {
            if (node.kind() == NodeKind.INDEXED) {
                addIndexed(node.attribute(AstNode.KEY, ""), owner);
            } else if (node.kind() == NodeKind.REFERENCE) {
                addReference(node.attribute(AstNode.ID, ""), owner);
            }
            return true;
        }
    }
}
