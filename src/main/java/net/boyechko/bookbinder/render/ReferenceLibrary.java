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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.boyechko.bookbinder.content.Frontmatter;
import net.boyechko.bookbinder.content.NameRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * References read from a directory of markup files, one record per file. The id is the
 * frontmatter {@code id} if present, else the file name without extension.
 */
public final class ReferenceLibrary implements ReferenceLookup {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceLibrary.class);

    private final Map<String, Reference> references;

    private ReferenceLibrary(Map<String, Reference> references) {
        this.references = references;
    }

    public static ReferenceLibrary load(Path dir) throws IOException {
        Map<String, Reference> references = new TreeMap<>();
        if (!Files.isDirectory(dir)) {
            logger.debug("No references directory at {}", dir);
            return new ReferenceLibrary(references);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files =
                    listing.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(NameRules.EXTENSION))
                            .filter(p -> !NameRules.isIgnored(p.getFileName().toString()))
                            .sorted()
                            .collect(Collectors.toList());
        }
        for (Path file : files) {
            Frontmatter.Parts parts =
                    Frontmatter.split(Files.readString(file, StandardCharsets.UTF_8));
            String fileName = file.getFileName().toString();
            String id = fileName.substring(0, fileName.length() - NameRules.EXTENSION.length());
            Object explicitId = parts.metadata().get("id");
            if (explicitId != null && !explicitId.toString().isBlank()) {
                id = explicitId.toString().strip();
            }
            references.put(id, new Reference(id, parts.metadata()));
        }
        logger.debug("Loaded {} references from {}", references.size(), dir);
        return new ReferenceLibrary(references);
    }

    @Override
    public Optional<Reference> find(String id) {
        return Optional.ofNullable(references.get(id));
    }

    public Map<String, Reference> all() {
        return Collections.unmodifiableMap(references);
    }
}
