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

/** A leaf node backed by a single markup file. */
public class Text extends ContentNode {

    Text(String name, ContentContainer parent, MarkupDocument document) {
        super(name, parent, document);
    }

    @Override
    public Path location() {
        return parent().directory().resolve(name() + NameRules.EXTENSION);
    }

    @Override
    public Path backingFile() {
        return location();
    }

    @Override
    public Status status() {
        return Status.parse(metadata().get(STATUS));
    }

    void setStatus(Status status) {
        metadata().put(STATUS, status.label());
    }
}
