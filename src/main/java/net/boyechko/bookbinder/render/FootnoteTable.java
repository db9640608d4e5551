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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.bookbinder.content.ContentNode;
import net.boyechko.bookbinder.markup.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Footnotes collected during a render, keyed by scope (a text or a chapter) and label. Numbers
 * are assigned in order of first reference within a scope; a definition may arrive before or
 * after its first reference.
 */
final class FootnoteTable {
    private static final Logger logger = LoggerFactory.getLogger(FootnoteTable.class);

    static final class Note {
        private final String label;
        private int number; // 0 until referenced
        private List<AstNode> body; // null until defined

        private Note(String label) {
            this.label = label;
        }

        String label() {
            return label;
        }

        int number() {
            return number;
        }

        List<AstNode> body() {
            return body;
        }
    }

    private final Map<ContentNode, Map<String, Note>> scopes = new LinkedHashMap<>();
    private final Map<ContentNode, Integer> counters = new HashMap<>();

    /** Returns the number of the labelled note, assigning the next one on first reference. */
    int reference(ContentNode scope, String label) {
        Note note = noteFor(scope, label);
        if (note.number == 0) {
            int next = counters.merge(scope, 1, Integer::sum);
            note.number = next;
        }
        return note.number;
    }

    void define(ContentNode scope, String label, List<AstNode> body) {
        Note note = noteFor(scope, label);
        if (note.body != null) {
            logger.debug("Footnote {} defined twice in {}", label, scope.path());
        }
        note.body = body;
    }

    boolean hasNotes(ContentNode scope) {
        Map<String, Note> notes = scopes.get(scope);
        return notes != null && notes.values().stream().anyMatch(n -> n.number > 0);
    }

    /** Removes the scope and returns its referenced notes in number order. */
    List<Note> take(ContentNode scope) {
        Map<String, Note> notes = scopes.remove(scope);
        counters.remove(scope);
        List<Note> result = new ArrayList<>();
        if (notes == null) {
            return result;
        }
        for (Note note : notes.values()) {
            if (note.number > 0) {
                result.add(note);
            } else {
                logger.debug("Footnote {} in {} is never referenced", note.label, scope.path());
            }
        }
        result.sort(Comparator.comparingInt(Note::number));
        return result;
    }

    private Note noteFor(ContentNode scope, String label) {
        return scopes.computeIfAbsent(scope, s -> new LinkedHashMap<>())
                .computeIfAbsent(label, Note::new);
    }
}
