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
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats a reference entry by its type (article, book, link). Every field is optional; missing
 * ones are left out.
 */
public final class ReferenceFormatter {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceFormatter.class);

    /** A piece of formatted reference text. */
    public record Segment(String text, boolean italic, String url) {
        static Segment plain(String text) {
            return new Segment(text, false, null);
        }

        static Segment italic(String text) {
            return new Segment(text, true, null);
        }

        static Segment link(String text, String url) {
            return new Segment(text, false, url);
        }

        public boolean isLink() {
            return url != null;
        }
    }

    /** Main entry text and the external identifier links shown below it. */
    public record Formatted(List<Segment> body, List<Segment> links) {}

    private ReferenceFormatter() {}

    public static Formatted format(Reference reference) {
        List<Segment> body = new ArrayList<>();
        body.add(Segment.plain(formatAuthors(reference.authors())));
        switch (reference.type()) {
            case "article" -> formatArticle(reference, body);
            case "book" -> formatBook(reference, body);
            case "link" -> formatLink(reference, body);
            default -> logger.debug(
                    "Unknown type '{}' for reference {}", reference.type(), reference.id());
        }
        body.removeIf(s -> s.text().isEmpty());
        return new Formatted(body, externalLinks(reference));
    }

    /** "Last, First Middle" becomes "Last, F.M."; names without a comma are kept. */
    public static String shortName(String name) {
        String[] parts = name.split(",");
        if (parts.length == 1) {
            return name;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length - 1; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(parts[i].strip());
        }
        sb.append(", ");
        for (String given : parts[parts.length - 1].strip().split("\\s+")) {
            if (!given.isEmpty()) {
                sb.append(given.charAt(0)).append('.');
            }
        }
        return sb.toString();
    }

    static String formatAuthors(List<String> authors) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < authors.size(); i++) {
            if (i > 0) {
                sb.append(i == authors.size() - 1 ? " & " : ", ");
            }
            sb.append(shortName(authors.get(i)));
        }
        return sb.toString();
    }

    private static void formatArticle(Reference reference, List<Segment> body) {
        reference.field("year").ifPresent(year -> body.add(Segment.plain(" (" + year + ")")));
        reference
                .field("title")
                .ifPresent(title -> body.add(Segment.plain(" " + trimDots(title) + ".")));
        reference.field("journal").ifPresent(journal -> body.add(Segment.italic(" " + journal)));
        Optional<String> volume = reference.field("volume");
        if (volume.isPresent()) {
            body.add(Segment.plain(" " + volume.get()));
            reference
                    .field("number")
                    .ifPresent(number -> body.add(Segment.plain(" (" + number + ")")));
        }
        reference
                .field("pages")
                .map(pages -> pages.replace("--", "-"))
                .ifPresent(pages -> body.add(Segment.plain(": pp. " + pages + ".")));
    }

    private static void formatBook(Reference reference, List<Segment> body) {
        reference.field("year").ifPresent(year -> body.add(Segment.plain(" (" + year + ").")));
        reference
                .field("title")
                .ifPresent(title -> body.add(Segment.italic(" " + trimDots(title) + ".")));
        reference
                .field("publisher")
                .ifPresent(publisher -> body.add(Segment.plain(" " + publisher + ".")));
    }

    private static void formatLink(Reference reference, List<Segment> body) {
        reference.field("year").ifPresent(year -> body.add(Segment.plain(" (" + year + ").")));
        Optional<String> title = reference.field("title");
        title.ifPresent(t -> body.add(Segment.plain(" " + trimDots(t) + ".")));
        Optional<String> url = reference.field("url");
        if (url.isPresent()) {
            body.add(Segment.plain(" "));
            body.add(Segment.link(title.orElse(url.get()), url.get()));
        }
        reference
                .field("accessed")
                .ifPresent(accessed -> body.add(Segment.plain(" Accessed " + accessed + ".")));
    }

    private static List<Segment> externalLinks(Reference reference) {
        List<Segment> links = new ArrayList<>();
        reference.field("url").ifPresent(url -> links.add(Segment.link(url, url)));
        reference
                .field("doi")
                .ifPresent(doi -> links.add(Segment.link("DOI:" + doi, "https://doi.org/" + doi)));
        reference
                .field("pmid")
                .ifPresent(
                        pmid ->
                                links.add(
                                        Segment.link(
                                                "PubMed:" + pmid,
                                                "https://pubmed.ncbi.nlm.nih.gov/" + pmid)));
        reference
                .field("isbn")
                .ifPresent(
                        isbn ->
                                links.add(
                                        Segment.link(
                                                "ISBN:" + isbn,
                                                "https://isbnsearch.org/isbn/" + isbn)));
        return links;
    }

    private static String trimDots(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '.') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(start, end);
    }
}
