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

import java.nio.file.Files;
import java.util.IdentityHashMap;
import java.util.Map;
import net.boyechko.bookbinder.issues.Issue;
import net.boyechko.bookbinder.issues.IssueList;
import net.boyechko.bookbinder.issues.IssueLocation;
import net.boyechko.bookbinder.issues.IssueSeverity;
import net.boyechko.bookbinder.issues.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consistency check of a loaded book: tree against lookup table, paths against the parent chain,
 * backing files against the disk, and text digests against their recorded values. Nothing is
 * repaired here.
 */
final class IntegrityChecker {
    private static final Logger logger = LoggerFactory.getLogger(IntegrityChecker.class);

    private IntegrityChecker() {}

    static IssueList check(Book book) {
        IssueList issues = new IssueList();
        Map<ContentNode, Boolean> inTree = new IdentityHashMap<>();

        for (ContentNode node : book.allItems()) {
            inTree.put(node, Boolean.TRUE);
            checkNode(book, node, issues);
        }

        for (Map.Entry<String, ContentNode> entry : book.lookup().entrySet()) {
            ContentNode node = entry.getValue();
            if (!inTree.containsKey(node)) {
                issues.add(
                        error(
                                IssueType.LOOKUP_ORPHAN_ENTRY,
                                entry.getKey(),
                                "Lookup entry does not belong to the tree"));
            } else if (!entry.getKey().equals(node.path())) {
                issues.add(
                        error(
                                IssueType.PATH_MISMATCH,
                                entry.getKey(),
                                "Lookup key differs from node path " + node.path()));
            }
        }

        if (!issues.isEmpty()) {
            logger.warn("Integrity check of {} found {} issues", book.id(), issues.size());
        }
        return issues;
    }

    private static void checkNode(Book book, ContentNode node, IssueList issues) {
        String path = node.path();

        if (book.lookup().get(path) != node) {
            issues.add(error(IssueType.LOOKUP_MISSING_ENTRY, path, "Node missing from lookup"));
        }

        ContentContainer parent = node.parent();
        if (parent == null || parent.indexOf(node) < 0) {
            issues.add(error(IssueType.PATH_MISMATCH, path, "Node not listed by its parent"));
        } else if (!node.location().getParent().equals(parent.directory())) {
            issues.add(
                    error(IssueType.PATH_MISMATCH, path, "Backing location outside the parent"));
        }

        if (!Files.exists(node.backingFile())) {
            issues.add(
                    error(
                            IssueType.MISSING_BACKING_FILE,
                            path,
                            "Missing backing file " + node.backingFile()));
        }

        // Container digests go stale whenever a child is written, so only texts are compared
        if (node instanceof Text text) {
            String stored = text.storedDigest();
            if (stored != null && !stored.equals(text.digest())) {
                issues.add(error(IssueType.DIGEST_MISMATCH, path, "Digest does not match content"));
            }
        }
    }

    private static Issue error(IssueType type, String path, String message) {
        return new Issue(type, IssueSeverity.ERROR, new IssueLocation(path), message);
    }
}
