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
import java.util.List;
import java.util.Map;
import net.boyechko.bookbinder.content.ContentNode;

/** Occurrences of indexed terms collected during a render. */
final class IndexTable {

    record Occurrence(
            List<Integer> ordinal, String path, String heading, int page, String anchor) {}

    record Entry(String key, List<Occurrence> occurrences) {}

    static final Comparator<List<Integer>> ORDINAL_ORDER =
            (a, b) -> {
                for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
                    int cmp = Integer.compare(a.get(i), b.get(i));
                    if (cmp != 0) {
                        return cmp;
                    }
                }
                return Integer.compare(a.size(), b.size());
            };

    private final Map<String, List<Occurrence>> occurrences = new HashMap<>();
    private int count;

    /** Records an occurrence and returns the anchor name for it. */
    String add(String key, ContentNode node, int page) {
        count++;
        String anchor = "idx-" + count;
        occurrences
                .computeIfAbsent(key, k -> new ArrayList<>())
                .add(new Occurrence(node.ordinal(), node.path(), node.heading(), page, anchor));
        return anchor;
    }

    int count() {
        return count;
    }

    boolean isEmpty() {
        return occurrences.isEmpty();
    }

    /** Keys in case-insensitive order, each with its occurrences in structural order. */
    List<Entry> sortedEntries() {
        List<String> keys = new ArrayList<>(occurrences.keySet());
        keys.sort(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()));
        List<Entry> result = new ArrayList<>();
        for (String key : keys) {
            List<Occurrence> sorted = new ArrayList<>(occurrences.get(key));
            sorted.sort(Comparator.comparing(Occurrence::ordinal, ORDINAL_ORDER));
            result.add(new Entry(key, sorted));
        }
        return result;
    }
}
