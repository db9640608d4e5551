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

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.bookbinder.render.ReferenceFormatter.Formatted;
import net.boyechko.bookbinder.render.ReferenceFormatter.Segment;
import org.junit.jupiter.api.Test;

public class ReferenceFormatterTest {

    @Test
    void shortensGivenNames() {
        assertEquals("Smith, J.P.", ReferenceFormatter.shortName("Smith, John Paul"));
        assertEquals("Plato", ReferenceFormatter.shortName("Plato"));
    }

    @Test
    void joinsAuthorsWithAmpersandBeforeLast() {
        assertEquals(
                "Smith, J., Jones, A. & Brown, B.",
                ReferenceFormatter.formatAuthors(
                        List.of("Smith, John", "Jones, Ann", "Brown, Bob")));
        assertEquals("", ReferenceFormatter.formatAuthors(List.of()));
    }

    @Test
    void formatsArticle() {
        Formatted formatted =
                ReferenceFormatter.format(
                        reference(
                                "smith2020",
                                "type", "article",
                                "authors", List.of("Smith, John"),
                                "year", 2020,
                                "title", "A study...",
                                "journal", "Journal of Things",
                                "volume", 3,
                                "number", 2,
                                "pages", "10--20",
                                "doi", "10.1000/xyz"));

        assertEquals(
                "Smith, J. (2020) A study. Journal of Things 3 (2): pp. 10-20.",
                text(formatted.body()));
        assertTrue(formatted.body().get(3).italic());
        assertEquals(
                List.of(new Segment("DOI:10.1000/xyz", false, "https://doi.org/10.1000/xyz")),
                formatted.links());
    }

    @Test
    void formatsBookWithItalicTitle() {
        Formatted formatted =
                ReferenceFormatter.format(
                        reference(
                                "jones2019",
                                "type", "book",
                                "authors", "Jones, Ann",
                                "year", 2019,
                                "title", "Things",
                                "publisher", "Press",
                                "isbn", "123"));

        assertEquals("Jones, A. (2019). Things. Press.", text(formatted.body()));
        assertTrue(formatted.body().get(2).italic());
        assertEquals("ISBN:123", formatted.links().get(0).text());
    }

    @Test
    void formatsLinkWithTitleAsLinkText() {
        Formatted formatted =
                ReferenceFormatter.format(
                        reference(
                                "site",
                                "type", "link",
                                "title", "Home",
                                "url", "https://example.org",
                                "accessed", "2024-05-01"));

        Segment link = formatted.body().stream().filter(Segment::isLink).findFirst().orElseThrow();
        assertEquals("Home", link.text());
        assertEquals("https://example.org", link.url());
        assertTrue(text(formatted.body()).endsWith(" Accessed 2024-05-01."));
    }

    @Test
    void missingFieldsAreLeftOut() {
        Formatted formatted = ReferenceFormatter.format(reference("bare", "type", "article"));

        assertTrue(formatted.body().isEmpty());
        assertTrue(formatted.links().isEmpty());
    }

    private static Reference reference(String id, Object... keysAndValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            fields.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return new Reference(id, fields);
    }

    private static String text(List<Segment> segments) {
        return segments.stream().map(Segment::text).collect(Collectors.joining());
    }
}
