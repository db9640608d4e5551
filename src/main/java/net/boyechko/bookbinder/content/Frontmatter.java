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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Reads and writes the YAML metadata block that prefixes a markup file:
 *
 * <pre>
 * ---
 * title: Some title
 * ---
 * Content...
 * </pre>
 */
public final class Frontmatter {
    private static final Logger logger = LoggerFactory.getLogger(Frontmatter.class);

    private static final Pattern FRONTMATTER =
            Pattern.compile("^---(\\R.*?\\R)---\\R(.*)$", Pattern.DOTALL);
    private static final String DELIMITER = "---\n";

    /** Metadata and body of one markup file. */
    public record Parts(Map<String, Object> metadata, String content) {}

    private Frontmatter() {}

    public static Parts split(String text) {
        if (text == null) {
            return new Parts(new LinkedHashMap<>(), "");
        }
        Matcher m = FRONTMATTER.matcher(text);
        if (!m.matches()) {
            return new Parts(new LinkedHashMap<>(), text);
        }
        return new Parts(load(m.group(1)), m.group(2));
    }

    /** Joins metadata and content; the delimited block is omitted when metadata is empty. */
    public static String join(Map<String, Object> metadata, String content) {
        String body = content != null ? content : "";
        if (metadata == null || metadata.isEmpty()) {
            return body;
        }
        return DELIMITER + dump(metadata) + DELIMITER + body;
    }

    public static Map<String, Object> load(String yamlText) {
        try {
            Object loaded = newYaml().load(yamlText);
            if (loaded instanceof Map<?, ?> map) {
                Map<String, Object> result = new LinkedHashMap<>();
                map.forEach((k, v) -> result.put(String.valueOf(k), v));
                return result;
            }
            if (loaded != null) {
                logger.warn("Frontmatter is not a mapping; ignoring {}", loaded);
            }
        } catch (YAMLException e) {
            logger.warn("Invalid frontmatter YAML: {}", e.getMessage());
        }
        return new LinkedHashMap<>();
    }

    public static String dump(Map<String, Object> metadata) {
        return newYaml().dump(metadata);
    }

    /** Key-sorted dump used where a stable textual form is needed. */
    public static String canonicalDump(Map<String, Object> metadata) {
        return newYaml().dump(sorted(metadata));
    }

    /** Deep copy of nested maps and lists; scalar values are shared. */
    public static Map<String, Object> deepCopy(Map<String, Object> metadata) {
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((k, v) -> copy.put(k, copyValue(v)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        } else if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }

    private static Object sorted(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new TreeMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), sorted(v)));
            return result;
        } else if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>();
            for (Object item : list) {
                result.add(sorted(item));
            }
            return result;
        }
        return value;
    }

    private static Yaml newYaml() {
        DumperOptions dumper = new DumperOptions();
        dumper.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumper.setAllowUnicode(true);
        dumper.setIndent(2);
        LoaderOptions loader = new LoaderOptions();
        return new Yaml(new SafeConstructor(loader), new Representer(dumper), dumper, loader);
    }
}
