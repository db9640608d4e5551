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

import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.footnotes.Footnote;
import com.vladsch.flexmark.ext.footnotes.FootnoteBlock;
import com.vladsch.flexmark.ext.footnotes.FootnoteExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.misc.Extension;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MarkupParser} backed by flexmark-java with the footnotes extension. The flexmark tree is
 * converted into {@link AstNode}s; text runs are scanned for the {@link InlineSyntax} extensions.
 */
public final class FlexmarkMarkupParser implements MarkupParser {
    private static final Logger logger = LoggerFactory.getLogger(FlexmarkMarkupParser.class);

    private static final FlexmarkMarkupParser SHARED = new FlexmarkMarkupParser();

    private final Parser parser;
    private final HtmlRenderer renderer;

    public FlexmarkMarkupParser() {
        List<Extension> extensions = List.of(FootnoteExtension.create());
        MutableDataSet options = new MutableDataSet().set(Parser.EXTENSIONS, extensions);
        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
    }

    static FlexmarkMarkupParser shared() {
        return SHARED;
    }

    @Override
    public ParsedMarkup parse(String content) {
        if (content == null || content.isEmpty()) {
            return ParsedMarkup.empty();
        }
        Document document = parser.parse(content);
        String html = renderer.render(document);
        AstNode ast = AstNode.document(convertChildren(document));
        return new ParsedMarkup(html, ast);
    }

    private List<AstNode> convertChildren(Node parent) {
        List<AstNode> nodes = new ArrayList<>();
        StringBuilder pending = new StringBuilder();

        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof Text text) {
                pending.append(text.getChars().unescape());
            } else if (child instanceof SoftLineBreak) {
                pending.append('\n');
            } else if (child instanceof LinkRef ref && !ref.isDefined()) {
                // Unresolved [..] is plain text, and may carry [#term] or [@id]
                pending.append(ref.getChars());
            } else {
                flushText(pending, nodes);
                AstNode converted = convert(child);
                if (converted != null) {
                    nodes.add(converted);
                }
            }
        }
        flushText(pending, nodes);
        return nodes;
    }

    private static void flushText(StringBuilder pending, List<AstNode> nodes) {
        if (pending.length() > 0) {
            nodes.addAll(InlineSyntax.scan(pending.toString()));
            pending.setLength(0);
        }
    }

    private AstNode convert(Node node) {
        if (node instanceof Paragraph) {
            return AstNode.of(NodeKind.PARAGRAPH, convertChildren(node));
        } else if (node instanceof Heading heading) {
            return AstNode.of(
                    NodeKind.HEADING,
                    Map.of(AstNode.LEVEL, String.valueOf(heading.getLevel())),
                    convertChildren(node));
        } else if (node instanceof BlockQuote) {
            return AstNode.of(NodeKind.QUOTE, convertChildren(node));
        } else if (node instanceof Code code) {
            return AstNode.of(
                    NodeKind.CODE_SPAN, List.of(AstNode.rawText(code.getText().toString())));
        } else if (node instanceof FencedCodeBlock fenced) {
            return AstNode.of(
                    NodeKind.FENCED_CODE,
                    Map.of(AstNode.INFO, fenced.getInfo().toString()),
                    List.of(AstNode.rawText(fenced.getContentChars().toString())));
        } else if (node instanceof IndentedCodeBlock indented) {
            return AstNode.of(
                    NodeKind.CODE_BLOCK,
                    List.of(AstNode.rawText(indented.getContentChars().toString())));
        } else if (node instanceof StrongEmphasis) {
            return AstNode.of(NodeKind.STRONG_EMPHASIS, convertChildren(node));
        } else if (node instanceof Emphasis) {
            return AstNode.of(NodeKind.EMPHASIS, convertChildren(node));
        } else if (node instanceof HardLineBreak) {
            return AstNode.leaf(NodeKind.LINE_BREAK, "");
        } else if (node instanceof ThematicBreak) {
            return AstNode.leaf(NodeKind.THEMATIC_BREAK, "");
        } else if (node instanceof Link link) {
            return AstNode.of(
                    NodeKind.LINK,
                    Map.of(AstNode.DESTINATION, link.getUrl().toString()),
                    convertChildren(node));
        } else if (node instanceof AutoLink autoLink) {
            String url = autoLink.getUrl().toString();
            return AstNode.of(
                    NodeKind.LINK,
                    Map.of(AstNode.DESTINATION, url),
                    List.of(AstNode.rawText(autoLink.getText().toString())));
        } else if (node instanceof Image image) {
            return new AstNode(
                    NodeKind.IMAGE,
                    image.getText().toString(),
                    Map.of(AstNode.DESTINATION, image.getUrl().toString()),
                    null);
        } else if (node instanceof BulletList) {
            return AstNode.of(
                    NodeKind.LIST, Map.of(AstNode.ORDERED, "false"), convertChildren(node));
        } else if (node instanceof OrderedList ordered) {
            return AstNode.of(
                    NodeKind.LIST,
                    Map.of(
                            AstNode.ORDERED,
                            "true",
                            AstNode.START,
                            String.valueOf(ordered.getStartNumber())),
                    convertChildren(node));
        } else if (node instanceof ListItem) {
            return AstNode.of(NodeKind.LIST_ITEM, convertChildren(node));
        } else if (node instanceof Footnote footnote) {
            return AstNode.footnoteRef(footnote.getText().toString());
        } else if (node instanceof FootnoteBlock block) {
            return AstNode.footnoteDef(block.getText().toString(), convertChildren(node));
        } else if (node instanceof HtmlBlock || node instanceof HtmlInline) {
            return AstNode.leaf(NodeKind.HTML, node.getChars().toString());
        } else if (node instanceof LinkRef ref) {
            return AstNode.of(
                    NodeKind.LINK,
                    Map.of(AstNode.DESTINATION, ref.getReference().toString()),
                    convertChildren(node));
        }

        logger.debug("No markup mapping for {}", node.getNodeName());
        return new AstNode(
                NodeKind.UNKNOWN,
                node.getChars().toString(),
                Map.of(AstNode.TYPE, node.getNodeName()),
                convertChildren(node));
    }
}
