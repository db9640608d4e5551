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

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class FrontmatterTest {

    @Test
    void splitsMetadataFromContent() {
        Frontmatter.Parts parts =
                Frontmatter.split("---\ntitle: Hello\nstatus: draft\n---\nBody text\n");

        assertEquals("Hello", parts.metadata().get("title"));
        assertEquals("draft", parts.metadata().get("status"));
        assertEquals("Body text\n", parts.content());
    }

    @Test
    void textWithoutBlockIsAllContent() {
        Frontmatter.Parts parts = Frontmatter.split("Just text\n---\nmore");

        assertTrue(parts.metadata().isEmpty());
        assertEquals("Just text\n---\nmore", parts.content());
    }

    @Test
    void emptyMetadataOmitsTheBlock() {
        assertEquals("Body", Frontmatter.join(new LinkedHashMap<>(), "Body"));
    }

    @Test
    void joinedTextSplitsBackToTheSameParts() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", "Über «quotes»");
        metadata.put("keywords", List.of("alpha", "beta"));

        Frontmatter.Parts parts = Frontmatter.split(Frontmatter.join(metadata, "Line\n"));

        assertEquals(metadata, parts.metadata());
        assertEquals("Line\n", parts.content());
    }

    @Test
    void canonicalDumpIgnoresKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", 1);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", 1);
        second.put("b", 2);

        assertEquals(Frontmatter.canonicalDump(first), Frontmatter.canonicalDump(second));
    }

    @Test
    void invalidYamlYieldsEmptyMetadata() {
        Frontmatter.Parts parts = Frontmatter.split("---\n: [unclosed\n---\nBody");

        assertTrue(parts.metadata().isEmpty());
        assertEquals("Body", parts.content());
    }
}
