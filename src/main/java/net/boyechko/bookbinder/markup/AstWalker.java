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
package net.boyechko.bookbinder.markup;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks a markup tree once, invoking multiple visitors at each node. */
public class AstWalker {
    private static final Logger logger = LoggerFactory.getLogger(AstWalker.class);

    private final List<AstVisitor> visitors = new ArrayList<>();

    public AstWalker addVisitor(AstVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public void walk(AstNode root) {
        for (AstVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        if (root != null) {
            walkNode(root, 0);
        }

        for (AstVisitor visitor : visitors) {
            visitor.afterTraversal();
        }
    }

    private void walkNode(AstNode node, int depth) {
        // Children are skipped only if every visitor declines them
        boolean continueToChildren = visitors.isEmpty();
        for (AstVisitor visitor : visitors) {
            try {
                if (visitor.enterNode(node, depth)) {
                    continueToChildren = true;
                }
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} at {} node: {}",
                        visitor.name(),
                        node.kind(),
                        e.getMessage());
            }
        }

        if (continueToChildren) {
            for (AstNode child : node.children()) {
                walkNode(child, depth + 1);
            }
        }

        for (AstVisitor visitor : visitors) {
            try {
                visitor.leaveNode(node, depth);
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} leaving {} node: {}",
                        visitor.name(),
                        node.kind(),
                        e.getMessage());
            }
        }
    }
}
