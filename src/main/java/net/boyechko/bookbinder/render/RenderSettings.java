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

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.bookbinder.content.Book;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Per-book rendering settings. Defaults come from a classpath YAML resource; a book's frontmatter
 * {@code pdf} mapping overrides them key by key.
 */
public record RenderSettings(
        int contentsPages,
        int maxContentsPages,
        int pageBreakLevel,
        int contentsLevel,
        FootnotePlacement footnotePlacement,
        IndexXref indexXref,
        FontAccent indexedAccent,
        FontAccent referenceAccent,
        double fontSize,
        double lineHeight,
        List<Double> headingSizes) {
    private static final Logger logger = LoggerFactory.getLogger(RenderSettings.class);

    public static final String DEFAULTS_RESOURCE = "/render-defaults.yaml";
    /** Frontmatter key of the per-book settings. */
    public static final String BOOK_KEY = "pdf";

    public RenderSettings {
        if (contentsPages < 0 || maxContentsPages < contentsPages) {
            throw new IllegalArgumentException(
                    "Invalid contents pages " + contentsPages + " (max " + maxContentsPages + ")");
        }
        if (pageBreakLevel < 0 || contentsLevel < 0) {
            throw new IllegalArgumentException("Levels must not be negative");
        }
        if (headingSizes == null || headingSizes.isEmpty()) {
            throw new IllegalArgumentException("At least one heading size is required");
        }
        headingSizes = List.copyOf(headingSizes);
    }

    /** Deepest heading level with its own size; deeper levels use this level's size. */
    public int maxHeadingLevel() {
        return headingSizes.size();
    }

    public double headingSize(int level) {
        int clamped = Math.max(1, Math.min(level, maxHeadingLevel()));
        return headingSizes.get(clamped - 1);
    }

    public RenderSettings withContentsPages(int pages) {
        return new RenderSettings(
                pages,
                Math.max(pages, maxContentsPages),
                pageBreakLevel,
                contentsLevel,
                footnotePlacement,
                indexXref,
                indexedAccent,
                referenceAccent,
                fontSize,
                lineHeight,
                headingSizes);
    }

    public RenderSettings withFootnotePlacement(FootnotePlacement placement) {
        return new RenderSettings(
                contentsPages,
                maxContentsPages,
                pageBreakLevel,
                contentsLevel,
                placement,
                indexXref,
                indexedAccent,
                referenceAccent,
                fontSize,
                lineHeight,
                headingSizes);
    }

    public RenderSettings withIndexXref(IndexXref xref) {
        return new RenderSettings(
                contentsPages,
                maxContentsPages,
                pageBreakLevel,
                contentsLevel,
                footnotePlacement,
                xref,
                indexedAccent,
                referenceAccent,
                fontSize,
                lineHeight,
                headingSizes);
    }

    /** Settings from the defaults resource only. */
    public static RenderSettings defaults() {
        return fromMap(loadDefaults());
    }

    /** Defaults overridden by the book's {@code pdf} frontmatter mapping. */
    public static RenderSettings forBook(Book book) {
        Map<String, Object> merged = loadDefaults();
        Object overrides = book.metadata().get(BOOK_KEY);
        if (overrides instanceof Map<?, ?> map) {
            map.forEach((k, v) -> merged.put(String.valueOf(k), v));
        } else if (overrides != null) {
            logger.warn("Ignoring non-mapping '{}' settings in book {}", BOOK_KEY, book.id());
        }
        return fromMap(merged);
    }

    static RenderSettings fromMap(Map<String, Object> values) {
        return new RenderSettings(
                intValue(values, "contents_pages"),
                intValue(values, "contents_max_pages"),
                intValue(values, "page_break_level"),
                intValue(values, "contents_level"),
                FootnotePlacement.fromLabel(stringValue(values, "footnotes_location")),
                IndexXref.fromLabel(stringValue(values, "indexed_xref")),
                FontAccent.fromLabel(stringValue(values, "indexed_font")),
                FontAccent.fromLabel(stringValue(values, "reference_font")),
                doubleValue(values.get("font_size"), "font_size"),
                doubleValue(values.get("line_height"), "line_height"),
                headingSizes(values.get("heading_sizes")));
    }

    private static Map<String, Object> loadDefaults() {
        try (InputStream inputStream =
                RenderSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (inputStream == null) {
                throw new IllegalStateException("Resource not found: " + DEFAULTS_RESOURCE);
            }
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Map<String, Object> loaded = yaml.load(inputStream);
            return new LinkedHashMap<>(loaded);
        } catch (Exception e) {
            logger.error(
                    "Failed to load render defaults from {}: {}",
                    DEFAULTS_RESOURCE,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load render defaults from "
                            + DEFAULTS_RESOURCE
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    private static int intValue(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            throw new IllegalArgumentException("Missing render setting " + key);
        }
        return Integer.parseInt(value.toString().strip());
    }

    private static String stringValue(Map<String, Object> values, String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    private static double doubleValue(Object value, String key) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            throw new IllegalArgumentException("Missing render setting " + key);
        }
        return Double.parseDouble(value.toString().strip());
    }

    private static List<Double> headingSizes(Object value) {
        List<Double> sizes = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                sizes.add(doubleValue(item, "heading_sizes"));
            }
        }
        return sizes;
    }
}
