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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable markup syntax tree node. Children are owned top-down; a node knows nothing about its
 * parent, and its identity is its position in the parent's child list.
 */
public record AstNode(
        NodeKind kind, String text, Map<String, String> attributes, List<AstNode> children) {

    public static final String DESTINATION = "destination";
    public static final String TITLE = "title";
    public static final String LEVEL = "level";
    public static final String ORDERED = "ordered";
    public static final String START = "start";
    public static final String INFO = "info";
    public static final String TERM = "term";
    public static final String KEY = "key";
    public static final String ID = "id";
    public static final String LABEL = "label";
    public static final String TYPE = "type";

    public AstNode {
        Objects.requireNonNull(kind, "kind");
        text = text != null ? text : "";
        attributes =
                attributes != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                        : Map.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static AstNode leaf(NodeKind kind, String text) {
        return new AstNode(kind, text, null, null);
    }

    public static AstNode of(NodeKind kind, List<AstNode> children) {
        return new AstNode(kind, null, null, children);
    }

    public static AstNode of(
            NodeKind kind, Map<String, String> attributes, List<AstNode> children) {
        return new AstNode(kind, null, attributes, children);
    }

    public static AstNode rawText(String text) {
        return leaf(NodeKind.RAW_TEXT, text);
    }

    public static AstNode document(List<AstNode> children) {
        return of(NodeKind.DOCUMENT, children);
    }

    public static AstNode paragraph(AstNode... children) {
        return of(NodeKind.PARAGRAPH, List.of(children));
    }

    public static AstNode indexed(String term, String canonicalKey) {
        return of(NodeKind.INDEXED, Map.of(TERM, term, KEY, canonicalKey), null);
    }

    public static AstNode reference(String id) {
        return of(NodeKind.REFERENCE, Map.of(ID, id), null);
    }

    public static AstNode footnoteRef(String label) {
        return of(NodeKind.FOOTNOTE_REF, Map.of(LABEL, label), null);
    }

    public static AstNode footnoteDef(String label, List<AstNode> children) {
        return of(NodeKind.FOOTNOTE_DEF, Map.of(LABEL, label), children);
    }

    public static AstNode link(String destination, AstNode... children) {
        return of(NodeKind.LINK, Map.of(DESTINATION, destination), List.of(children));
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public String attribute(String name, String fallback) {
        return attributes.getOrDefault(name, fallback);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Concatenates the text of the direct RAW_TEXT children only. */
    public String rawTextOfChildren() {
        StringBuilder sb = new StringBuilder();
        for (AstNode child : children) {
            if (child.kind() == NodeKind.RAW_TEXT) {
                sb.append(child.text());
            }
        }
        return sb.toString();
    }

    /** Concatenates all visible text below this node, depth first. */
    public String plainText() {
        StringBuilder sb = new StringBuilder();
        appendPlainText(sb);
        return sb.toString();
    }

    private void appendPlainText(StringBuilder sb) {
        switch (kind) {
            case INDEXED -> sb.append(attribute(TERM, ""));
            case REFERENCE -> sb.append(attribute(ID, ""));
            case EMDASH -> sb.append('—');
            default -> sb.append(text);
        }
        for (AstNode child : children) {
            child.appendPlainText(sb);
        }
    }
}
