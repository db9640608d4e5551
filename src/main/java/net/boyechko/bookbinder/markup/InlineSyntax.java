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
package net.boyechko.bookbinder.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the inline extensions that plain markdown leaves as text: {@code ~sub~}, {@code
 * ^sup^}, {@code ---}, {@code [#term]}, {@code [#term|key]} and {@code [@reference id]}.
 */
public final class InlineSyntax {

    private static final Pattern INLINE =
            Pattern.compile(
                    "(?<indexed>\\[#(?<term>[^\\]|]+)(?:\\|(?<key>[^\\]]+))?\\])"
                            + "|(?<reference>\\[@(?<id>[^\\]]+)\\])"
                            + "|(?<sub>(?<!~)~(?<subtext>[^~]+)~(?!~))"
                            + "|(?<sup>(?<!\\^)\\^(?<suptext>[^\\^]+)\\^(?!\\^))"
                            + "|(?<emdash>(?<!-)---(?!-))");

    private InlineSyntax() {}

    /** Splits text into raw text runs and extension nodes, in source order. */
    public static List<AstNode> scan(String text) {
        List<AstNode> nodes = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return nodes;
        }

        Matcher m = INLINE.matcher(text);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                nodes.add(AstNode.rawText(text.substring(last, m.start())));
            }
            nodes.add(toNode(m));
            last = m.end();
        }
        if (last < text.length()) {
            nodes.add(AstNode.rawText(text.substring(last)));
        }
        return nodes;
    }

    private static AstNode toNode(Matcher m) {
        if (m.group("indexed") != null) {
            String term = m.group("term").strip();
            String key = m.group("key") != null ? m.group("key").strip() : term;
            return AstNode.indexed(term, key);
        } else if (m.group("reference") != null) {
            return AstNode.reference(m.group("id").strip());
        } else if (m.group("sub") != null) {
            return AstNode.of(NodeKind.SUBSCRIPT, List.of(AstNode.rawText(m.group("subtext"))));
        } else if (m.group("sup") != null) {
            return AstNode.of(NodeKind.SUPERSCRIPT, List.of(AstNode.rawText(m.group("suptext"))));
        }
        return AstNode.leaf(NodeKind.EMDASH, "");
    }
}
