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

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import net.boyechko.bookbinder.content.Book;
import net.boyechko.bookbinder.content.ContentContainer;
import net.boyechko.bookbinder.content.ContentNode;
import net.boyechko.bookbinder.issues.Issue;
import net.boyechko.bookbinder.issues.IssueList;
import net.boyechko.bookbinder.issues.IssueLocation;
import net.boyechko.bookbinder.issues.IssueSeverity;
import net.boyechko.bookbinder.issues.IssueType;
import net.boyechko.bookbinder.markup.AstNode;
import net.boyechko.bookbinder.markup.NodeKind;
import net.boyechko.bookbinder.render.StyleSnapshot.Family;
import net.boyechko.bookbinder.render.StyleSnapshot.Vertical;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a book and its markup trees and drives a {@link DocumentSink}: title page, reserved
 * contents pages, numbered item headings, footnotes, references appendix and index.
 *
 * <p>When the contents overflow their reserved pages the whole book is rendered again into a
 * fresh sink with one more page, up to the configured maximum; past that the book is rendered
 * without contents.
 */
public class RenderEngine {
    private static final Logger logger = LoggerFactory.getLogger(RenderEngine.class);

    static final int MAX_LIST_DEPTH = 3;
    static final String EM_DASH = "—";
    static final String BULLET = "• ";
    static final String FOOTNOTES = "Footnotes";
    static final String REFERENCES = "References";
    static final String INDEX = "Index";
    static final String CONTENTS = "Contents";

    private static final double QUOTE_INDENT = 30;
    private static final double CODE_INDENT = 20;
    private static final double LIST_INDENT = 15;
    private static final double NOTE_INDENT = 20;
    private static final double LINK_LIST_INDENT = 20;
    private static final double TITLE_SCALE = 1.4;
    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final RenderSettings settings;
    private final ReferenceLookup references;
    private final Supplier<DocumentSink> sinkFactory;
    private final Clock clock;

    public RenderEngine(
            RenderSettings settings, ReferenceLookup references, Supplier<DocumentSink> sinks) {
        this(settings, references, sinks, Clock.systemDefaultZone());
    }

    public RenderEngine(
            RenderSettings settings,
            ReferenceLookup references,
            Supplier<DocumentSink> sinks,
            Clock clock) {
        this.settings = settings;
        this.references = references;
        this.sinkFactory = sinks;
        this.clock = clock;
    }

    public RenderSettings settings() {
        return settings;
    }

    public RenderResult render(Book book) {
        if (settings.contentsPages() == 0) {
            return new Pass(book, sinkFactory.get(), 0).run();
        }

        for (int pages = settings.contentsPages();
                pages <= settings.maxContentsPages();
                pages++) {
            DocumentSink sink = sinkFactory.get();
            try {
                return new Pass(book, sink, pages).run();
            } catch (ContentsOverflowException e) {
                sink.discard();
                logger.debug(
                        "Contents of {} overflow {} pages: {}", book.id(), pages, e.getMessage());
            }
        }

        logger.warn(
                "Contents of {} do not fit in {} pages; rendering without contents",
                book.id(),
                settings.maxContentsPages());
        Pass fallback = new Pass(book, sinkFactory.get(), 0);
        fallback.issues.add(
                new Issue(
                        IssueType.CONTENTS_OMITTED,
                        IssueSeverity.WARNING,
                        "Contents need more than " + settings.maxContentsPages() + " pages"));
        return fallback.run();
    }

    /** Per-list state; depth is clamped to the deepest list style. */
    private static final class ListContext {
        final boolean ordered;
        final int depth;
        int count;
        boolean firstParagraph;

        ListContext(boolean ordered, int depth, int start) {
            this.ordered = ordered;
            this.depth = depth;
            this.count = start - 1;
        }
    }

    /** One complete rendering into one sink. */
    private final class Pass {
        private final Book book;
        private final DocumentSink sink;
        private final int contentsPages;
        private final StyleStack style;
        private final FootnoteTable footnotes = new FootnoteTable();
        private final IndexTable index = new IndexTable();
        private final Set<String> cited = new TreeSet<>();
        private final Deque<ListContext> lists = new ArrayDeque<>();
        private final IssueList issues = new IssueList();

        private ContentNode current;
        private boolean suppressBreak;
        private int quoteDepth;
        private boolean inNote;

        Pass(Book book, DocumentSink sink, int contentsPages) {
            this.book = book;
            this.sink = sink;
            this.contentsPages = contentsPages;
            this.style = new StyleStack(sink, StyleSnapshot.defaults(settings));
            this.current = book;
        }

        RenderResult run() {
            logger.debug("Rendering {} with {} contents pages", book.id(), contentsPages);
            sink.beginPage();
            writeTitlePage();

            if (contentsPages > 0) {
                sink.insertPageBreak();
                sink.reserveContents(contentsPages, this::writeContents);
                suppressBreak = true;
            }

            for (ContentNode item : book.children()) {
                renderItem(item);
                if (settings.footnotePlacement() == FootnotePlacement.EACH_CHAPTER) {
                    writeChapterNotes(item);
                }
            }
            if (settings.footnotePlacement() == FootnotePlacement.END_OF_BOOK) {
                writeBookNotes();
            }

            writeReferences();
            writeIndex();

            byte[] output = sink.finish();
            logger.info(
                    "Rendered {}: {} bytes, {} index entries, {} references",
                    book.id(),
                    output.length,
                    index.count(),
                    cited.size());
            return new RenderResult(output, issues, contentsPages);
        }

        // ── Book structure ────────────────────────────────────────────

        private void writeTitlePage() {
            sink.beginParagraph(ParagraphStyle.TITLE);
            try (StyleStack.Scope s =
                    style.push(
                            StyleChange.none()
                                    .withBold(true)
                                    .withSize(settings.headingSize(1) * TITLE_SCALE))) {
                write(book.title());
            }

            String subtitle = book.subtitle();
            if (subtitle != null && !subtitle.isBlank()) {
                sink.beginParagraph(ParagraphStyle.SUBTITLE);
                try (StyleStack.Scope s =
                        style.push(StyleChange.none().withSize(settings.headingSize(1)))) {
                    write(subtitle);
                }
            }

            List<String> authors = book.authors();
            if (!authors.isEmpty()) {
                sink.beginParagraph(ParagraphStyle.NORMAL);
                try (StyleStack.Scope s =
                        style.push(StyleChange.none().withSize(settings.headingSize(2)))) {
                    write(String.join(", ", authors));
                }
            }

            current = book;
            render(book.ast());
            writeNotes(footnotes.take(book), 6);

            sink.beginParagraph(ParagraphStyle.NORMAL);
            write("Status: " + book.status().label());
            sink.beginParagraph(ParagraphStyle.NORMAL);
            write("Created: " + LocalDateTime.now(clock).format(CREATED_FORMAT));
        }

        private void writeContents(DocumentSink target, List<OutlineEntry> outline) {
            List<List<String>> rows = new ArrayList<>();
            rows.add(List.of(CONTENTS, ""));
            for (OutlineEntry entry : outline) {
                if (entry.level() > settings.contentsLevel()) {
                    continue;
                }
                String indent = "  ".repeat(Math.max(0, entry.level() - 1));
                rows.add(List.of(indent + entry.heading(), String.valueOf(entry.page())));
            }
            target.addTable(rows);
        }

        private void renderItem(ContentNode node) {
            int level = node.level();
            if (level <= settings.pageBreakLevel()) {
                pageBreak();
            }
            if (level <= settings.contentsLevel()) {
                sink.beginNamedSection(node.heading(), level);
            }
            writeHeading(node.heading(), level);

            current = node;
            render(node.ast());
            if (settings.footnotePlacement() == FootnotePlacement.EACH_TEXT) {
                writeNotes(footnotes.take(node), 6);
            }

            if (node instanceof ContentContainer container) {
                for (ContentNode child : container.children()) {
                    renderItem(child);
                }
            }
        }

        private void writeHeading(String text, int level) {
            int clamped = Math.max(1, Math.min(level, settings.maxHeadingLevel()));
            sink.beginParagraph(ParagraphStyle.heading(clamped));
            try (StyleStack.Scope s =
                    style.push(
                            StyleChange.none()
                                    .withBold(true)
                                    .withSize(settings.headingSize(clamped)))) {
                write(text);
            }
        }

        private void pageBreak() {
            if (suppressBreak) {
                suppressBreak = false;
                return;
            }
            sink.insertPageBreak();
        }

        // ── Footnotes ─────────────────────────────────────────────────

        private ContentNode noteScope() {
            return settings.footnotePlacement() == FootnotePlacement.EACH_TEXT
                    ? current
                    : current.chapter();
        }

        private void writeChapterNotes(ContentNode chapter) {
            List<FootnoteTable.Note> notes = footnotes.take(chapter);
            if (notes.isEmpty()) {
                return;
            }
            sink.insertPageBreak();
            writeNotes(notes, 4);
        }

        private void writeBookNotes() {
            List<ContentNode> chapters = new ArrayList<>();
            for (ContentNode chapter : book.children()) {
                if (footnotes.hasNotes(chapter)) {
                    chapters.add(chapter);
                }
            }
            if (chapters.isEmpty()) {
                return;
            }
            sink.insertPageBreak();
            sink.beginNamedSection(FOOTNOTES, 1);
            writeHeading(FOOTNOTES, 1);
            for (ContentNode chapter : chapters) {
                writeHeading(chapter.heading(), 2);
                writeNoteBodies(footnotes.take(chapter));
            }
        }

        private void writeNotes(List<FootnoteTable.Note> notes, int headingLevel) {
            if (notes.isEmpty()) {
                return;
            }
            writeHeading(FOOTNOTES, headingLevel);
            writeNoteBodies(notes);
        }

        private void writeNoteBodies(List<FootnoteTable.Note> notes) {
            inNote = true;
            try (StyleStack.Scope s =
                    style.push(
                            StyleChange.none()
                                    .withLeftIndent(style.current().leftIndent() + NOTE_INDENT))) {
                for (FootnoteTable.Note note : notes) {
                    sink.beginParagraph(ParagraphStyle.FOOTNOTE);
                    write(note.number() + ". ");
                    List<AstNode> body = note.body();
                    if (body == null) {
                        logger.warn("Footnote {} in {} has no definition", note.label(), current);
                        issues.add(
                                new Issue(
                                        IssueType.UNDEFINED_FOOTNOTE,
                                        IssueSeverity.WARNING,
                                        location(),
                                        "Footnote [^" + note.label() + "] is never defined"));
                        continue;
                    }
                    for (int i = 0; i < body.size(); i++) {
                        AstNode child = body.get(i);
                        if (i == 0 && child.kind() == NodeKind.PARAGRAPH) {
                            renderChildren(child);
                        } else {
                            render(child);
                        }
                    }
                }
            } finally {
                inNote = false;
            }
        }

        // ── Appendices ────────────────────────────────────────────────

        private void writeReferences() {
            if (cited.isEmpty()) {
                return;
            }
            sink.insertPageBreak();
            sink.beginNamedSection(REFERENCES, 1);
            writeHeading(REFERENCES, 1);

            for (String id : cited) {
                sink.beginParagraph(ParagraphStyle.REFERENCE);
                try (StyleStack.Scope s = style.push(StyleChange.none().withBold(true))) {
                    write(id);
                }
                write("  ");

                Optional<Reference> reference = references.find(id);
                if (reference.isEmpty()) {
                    logger.warn("Reference {} cited in {} is not in the library", id, book.id());
                    issues.add(
                            new Issue(
                                    IssueType.UNKNOWN_REFERENCE,
                                    IssueSeverity.WARNING,
                                    "No reference with id " + id));
                    continue;
                }

                ReferenceFormatter.Formatted formatted = ReferenceFormatter.format(reference.get());
                for (ReferenceFormatter.Segment segment : formatted.body()) {
                    writeSegment(segment);
                }
                if (!formatted.links().isEmpty()) {
                    sink.beginParagraph(ParagraphStyle.REFERENCE);
                    try (StyleStack.Scope s =
                            style.push(
                                    StyleChange.none()
                                            .withLeftIndent(
                                                    style.current().leftIndent()
                                                            + LINK_LIST_INDENT))) {
                        for (int i = 0; i < formatted.links().size(); i++) {
                            if (i > 0) {
                                write(", ");
                            }
                            writeSegment(formatted.links().get(i));
                        }
                    }
                }
            }
        }

        private void writeSegment(ReferenceFormatter.Segment segment) {
            if (segment.isLink()) {
                hyperlink(segment.text(), segment.url());
            } else if (segment.italic()) {
                try (StyleStack.Scope s = style.push(StyleChange.none().withItalic(true))) {
                    write(segment.text());
                }
            } else {
                write(segment.text());
            }
        }

        private void writeIndex() {
            if (settings.indexXref() == IndexXref.NONE || index.isEmpty()) {
                return;
            }
            sink.insertPageBreak();
            sink.beginNamedSection(INDEX, 1);
            writeHeading(INDEX, 1);

            for (IndexTable.Entry entry : index.sortedEntries()) {
                sink.beginParagraph(ParagraphStyle.INDEX_ENTRY);
                write(entry.key() + "  ");
                List<IndexTable.Occurrence> occurrences = entry.occurrences();
                for (int i = 0; i < occurrences.size(); i++) {
                    if (i > 0) {
                        write(", ");
                    }
                    IndexTable.Occurrence occurrence = occurrences.get(i);
                    String label =
                            switch (settings.indexXref()) {
                                case PAGE_NUMBER -> String.valueOf(occurrence.page());
                                case FULL_PATH -> occurrence.path();
                                case HEADING -> occurrence.heading();
                                case NONE -> throw new IllegalStateException("Index disabled");
                            };
                    try (StyleStack.Scope s = style.push(linkChange())) {
                        sink.addInternalLink(label, occurrence.anchor(), style.current());
                    }
                }
            }
        }

        // ── Markup nodes ──────────────────────────────────────────────

        private void render(AstNode node) {
            Runnable handler =
                    switch (node.kind()) {
                        case DOCUMENT, BLANK_LINE -> () -> renderChildren(node);
                        case PARAGRAPH -> () -> renderParagraph(node);
                        case RAW_TEXT -> () -> renderRawText(node);
                        case LINE_BREAK -> sink::lineBreak;
                        case HEADING -> () -> renderMarkupHeading(node);
                        case QUOTE -> () -> renderQuote(node);
                        case CODE_SPAN -> () -> renderCodeSpan(node);
                        case CODE_BLOCK, FENCED_CODE -> () -> renderCodeBlock(node);
                        case EMPHASIS ->
                                () -> renderStyled(node, StyleChange.none().withItalic(true));
                        case STRONG_EMPHASIS ->
                                () -> renderStyled(node, StyleChange.none().withBold(true));
                        case SUBSCRIPT ->
                                () ->
                                        renderStyled(
                                                node,
                                                StyleChange.none()
                                                        .withVertical(Vertical.SUBSCRIPT));
                        case SUPERSCRIPT ->
                                () ->
                                        renderStyled(
                                                node,
                                                StyleChange.none()
                                                        .withVertical(Vertical.SUPERSCRIPT));
                        case EMDASH -> () -> write(EM_DASH);
                        case THEMATIC_BREAK -> sink::horizontalRule;
                        case LINK -> () -> renderLink(node);
                        case IMAGE -> () -> renderImage(node);
                        case LIST -> () -> renderList(node);
                        case LIST_ITEM -> () -> renderListItem(node);
                        case INDEXED -> () -> renderIndexed(node);
                        case REFERENCE -> () -> renderReference(node);
                        case FOOTNOTE_REF -> () -> renderFootnoteRef(node);
                        case FOOTNOTE_DEF -> () -> renderFootnoteDef(node);
                        case HTML, UNKNOWN -> () -> unhandled(node);
                    };
            handler.run();
        }

        private void renderChildren(AstNode node) {
            for (AstNode child : node.children()) {
                render(child);
            }
        }

        private void renderParagraph(AstNode node) {
            ListContext list = lists.peek();
            if (inNote) {
                sink.beginParagraph(ParagraphStyle.FOOTNOTE);
            } else if (list != null && list.firstParagraph) {
                list.firstParagraph = false;
                sink.beginParagraph(
                        list.ordered
                                ? ParagraphStyle.listNumber(list.depth)
                                : ParagraphStyle.listBullet(list.depth));
                try (StyleStack.Scope s = style.push(StyleChange.none().withBold(true))) {
                    write(list.ordered ? list.count + ". " : BULLET);
                }
            } else if (list != null) {
                sink.beginParagraph(ParagraphStyle.listContinue(list.depth));
            } else if (quoteDepth > 0) {
                sink.beginParagraph(ParagraphStyle.QUOTE);
            } else {
                sink.beginParagraph(ParagraphStyle.NORMAL);
            }
            renderChildren(node);
        }

        private void renderRawText(AstNode node) {
            String text = node.text();
            if (text.endsWith("\n")) {
                text = text.substring(0, text.length() - 1);
            }
            write(text.replace('\n', ' '));
        }

        private void renderMarkupHeading(AstNode node) {
            int markupLevel = Integer.parseInt(node.attribute(AstNode.LEVEL, "1"));
            int level = Math.min(current.level() + markupLevel, settings.maxHeadingLevel());
            sink.beginParagraph(ParagraphStyle.heading(level));
            try (StyleStack.Scope s =
                    style.push(
                            StyleChange.none()
                                    .withBold(true)
                                    .withSize(settings.headingSize(level)))) {
                renderChildren(node);
            }
        }

        private void renderQuote(AstNode node) {
            StyleSnapshot now = style.current();
            quoteDepth++;
            try (StyleStack.Scope s =
                    style.push(
                            StyleChange.none()
                                    .withFamily(Family.SERIF)
                                    .withLeftIndent(now.leftIndent() + QUOTE_INDENT)
                                    .withRightIndent(now.rightIndent() + QUOTE_INDENT))) {
                renderChildren(node);
            } finally {
                quoteDepth--;
            }
        }

        private void renderCodeSpan(AstNode node) {
            try (StyleStack.Scope s = style.push(StyleChange.none().withFamily(Family.MONO))) {
                write(node.rawTextOfChildren());
            }
        }

        private void renderCodeBlock(AstNode node) {
            String code = node.rawTextOfChildren();
            if (code.endsWith("\n")) {
                code = code.substring(0, code.length() - 1);
            }
            try (StyleStack.Scope s =
                    style.push(
                            StyleChange.none()
                                    .withFamily(Family.MONO)
                                    .withLeftIndent(style.current().leftIndent() + CODE_INDENT))) {
                sink.beginParagraph(ParagraphStyle.CODE);
                String[] lines = code.split("\n", -1);
                for (int i = 0; i < lines.length; i++) {
                    if (i > 0) {
                        sink.lineBreak();
                    }
                    write(lines[i]);
                }
            }
            sink.beginParagraph(ParagraphStyle.NORMAL);
        }

        private void renderStyled(AstNode node, StyleChange change) {
            try (StyleStack.Scope s = style.push(change)) {
                renderChildren(node);
            }
        }

        private void renderLink(AstNode node) {
            String destination = node.attribute(AstNode.DESTINATION, "");
            String label = node.plainText();
            hyperlink(label.isEmpty() ? destination : label, destination);
        }

        private void renderImage(AstNode node) {
            String description = node.plainText();
            if (description.isEmpty()) {
                description = node.attribute(AstNode.DESTINATION, "");
            }
            logger.debug(
                    "Image {} rendered as its description", node.attribute(AstNode.DESTINATION));
            try (StyleStack.Scope s = style.push(StyleChange.none().withItalic(true))) {
                write(description);
            }
        }

        private void renderList(AstNode node) {
            boolean ordered = Boolean.parseBoolean(node.attribute(AstNode.ORDERED, "false"));
            int start = Integer.parseInt(node.attribute(AstNode.START, "1"));
            int nesting = lists.size() + 1;
            int depth = Math.min(nesting, MAX_LIST_DEPTH);

            StyleChange indent =
                    nesting <= MAX_LIST_DEPTH
                            ? StyleChange.none()
                                    .withLeftIndent(style.current().leftIndent() + LIST_INDENT)
                            : StyleChange.none();
            lists.push(new ListContext(ordered, depth, start));
            try (StyleStack.Scope s = style.push(indent)) {
                renderChildren(node);
            } finally {
                lists.pop();
            }
        }

        private void renderListItem(AstNode node) {
            ListContext list = lists.peek();
            if (list == null) {
                renderChildren(node);
                return;
            }
            list.count++;
            list.firstParagraph = true;
            renderChildren(node);
            list.firstParagraph = false;
        }

        private void renderIndexed(AstNode node) {
            String term = node.attribute(AstNode.TERM, "");
            String key = node.attribute(AstNode.KEY, term);
            String anchor = index.add(key, current, sink.currentPage());
            try (StyleStack.Scope s = style.push(settings.indexedAccent().toChange())) {
                sink.writeAnchoredRun(term, style.current(), anchor);
            }
        }

        private void renderReference(AstNode node) {
            String id = node.attribute(AstNode.ID, "");
            cited.add(id);
            try (StyleStack.Scope s = style.push(settings.referenceAccent().toChange())) {
                write(id);
            }
        }

        private void renderFootnoteRef(AstNode node) {
            int number = footnotes.reference(noteScope(), node.attribute(AstNode.LABEL, ""));
            try (StyleStack.Scope s =
                    style.push(
                            StyleChange.none().withBold(true).withVertical(Vertical.SUPERSCRIPT))) {
                write(String.valueOf(number));
            }
        }

        private void renderFootnoteDef(AstNode node) {
            footnotes.define(noteScope(), node.attribute(AstNode.LABEL, ""), node.children());
        }

        private void unhandled(AstNode node) {
            logger.warn("Skipping unhandled {} node in {}", node.kind(), current);
            issues.add(
                    new Issue(
                            IssueType.UNKNOWN_NODE,
                            IssueSeverity.WARNING,
                            location(),
                            "Unhandled " + node.kind() + " node"));
        }

        // ── Helpers ───────────────────────────────────────────────────

        private void write(String text) {
            if (text != null && !text.isEmpty()) {
                sink.writeRun(text, style.current());
            }
        }

        private void hyperlink(String text, String url) {
            try (StyleStack.Scope s = style.push(linkChange())) {
                sink.addHyperlink(text, url, style.current());
            }
        }

        private StyleChange linkChange() {
            return StyleChange.none().withUnderline(true).withColor(StyleSnapshot.LINK_BLUE);
        }

        private IssueLocation location() {
            String path = current == book ? null : current.path();
            return new IssueLocation(path, sink.currentPage());
        }
    }
}
