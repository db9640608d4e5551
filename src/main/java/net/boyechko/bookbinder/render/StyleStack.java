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
package net.boyechko.bookbinder.render;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Pushdown stack of formatting snapshots. Each push and pop hands the sink only the attributes
 * that actually changed. Pushes return a {@link Scope} for use in try-with-resources, so the
 * enclosing state is restored on every exit path.
 */
public final class StyleStack {
    private final Deque<StyleSnapshot> stack = new ArrayDeque<>();
    private final DocumentSink sink;

    public StyleStack(DocumentSink sink, StyleSnapshot defaults) {
        this.sink = sink;
        stack.push(defaults);
    }

    public StyleSnapshot current() {
        return stack.peek();
    }

    public int depth() {
        return stack.size();
    }

    public Scope push(StyleChange change) {
        int depthBefore = stack.size();
        StyleSnapshot previous = stack.peek();
        StyleSnapshot next = previous.apply(change);
        stack.push(next);
        StyleChange diff = previous.diff(next);
        if (!diff.isEmpty()) {
            sink.applyStyle(diff, next);
        }
        return new Scope(depthBefore);
    }

    public void pop() {
        if (stack.size() <= 1) {
            throw new IllegalStateException("Cannot pop the default style");
        }
        StyleSnapshot popped = stack.pop();
        StyleChange diff = popped.diff(stack.peek());
        if (!diff.isEmpty()) {
            sink.applyStyle(diff, stack.peek());
        }
    }

    /** Restores the stack to its depth before the matching push. */
    public final class Scope implements AutoCloseable {
        private final int depth;

        private Scope(int depth) {
            this.depth = depth;
        }

        @Override
        public void close() {
            while (stack.size() > depth) {
                pop();
            }
        }
    }
}
