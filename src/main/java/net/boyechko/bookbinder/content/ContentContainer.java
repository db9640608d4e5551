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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** A content node with an ordered list of children, backed by a directory and index record. */
public abstract class ContentContainer extends ContentNode {
    static final String SUM_WORDS = "sum_words";
    static final String SUM_CHARACTERS = "sum_characters";

    private final List<ContentNode> children = new ArrayList<>();

    ContentContainer(String name, ContentContainer parent, MarkupDocument document) {
        super(name, parent, document);
    }

    public List<ContentNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<ContentNode> child(String name) {
        return children.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public int indexOf(ContentNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public Path backingFile() {
        return location().resolve(NameRules.INDEX_FILE);
    }

    /** Directory holding the children. */
    public Path directory() {
        return location();
    }

    @Override
    public int sumWords() {
        int sum = wordCount();
        for (ContentNode child : children) {
            sum += child.sumWords();
        }
        return sum;
    }

    @Override
    public int sumCharacters() {
        int sum = characterCount();
        for (ContentNode child : children) {
            sum += child.sumCharacters();
        }
        return sum;
    }

    @Override
    void refreshDerived() {
        metadata().put(STATUS, status().label());
        metadata().put(SUM_CHARACTERS, sumCharacters());
        metadata().put(SUM_WORDS, sumWords());
    }

    void addChild(ContentNode child) {
        insertChild(children.size(), child);
    }

    void insertChild(int index, ContentNode child) {
        children.add(index, child);
        child.setParent(this);
    }

    void removeChild(ContentNode child) {
        int index = indexOf(child);
        if (index < 0) {
            throw new IllegalStateException(child + " is not a child of " + this);
        }
        children.remove(index);
    }

    void replaceChild(ContentNode existing, ContentNode replacement) {
        int index = indexOf(existing);
        if (index < 0) {
            throw new IllegalStateException(existing + " is not a child of " + this);
        }
        children.set(index, replacement);
        replacement.setParent(this);
    }

    void setChildren(List<ContentNode> ordered) {
        children.clear();
        for (ContentNode child : ordered) {
            addChild(child);
        }
    }
}
