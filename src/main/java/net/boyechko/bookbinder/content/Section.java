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
import java.util.stream.Collectors;

/** A container node backed by a directory with its own index record. */
public class Section extends ContentContainer {

    Section(String name, ContentContainer parent, MarkupDocument document) {
        super(name, parent, document);
    }

    @Override
    public Path location() {
        return parent().directory().resolve(name());
    }

    /** Least finished status among the children; {@link Status#LOWEST} when there are none. */
    @Override
    public Status status() {
        return Status.min(
                children().stream().map(ContentNode::status).collect(Collectors.toList()),
                Status.LOWEST);
    }
}
