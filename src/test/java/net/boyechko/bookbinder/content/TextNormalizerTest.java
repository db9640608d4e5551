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

import org.junit.jupiter.api.Test;

public class TextNormalizerTest {

    @Test
    void trimsTrailingWhitespaceOnEveryLine() {
        assertEquals("one\ntwo\n  three", TextNormalizer.normalize("one  \ntwo\t\n  three   "));
    }

    @Test
    void collapsesRunsOfBlankLines() {
        assertEquals("a\n\nb\n", TextNormalizer.normalize("a\n\n\n   \n\nb\n\n"));
    }

    @Test
    void keepsSingleBlankLinesAndLeadingIndentation() {
        String text = "para one\n\n    code\n\npara two";
        assertEquals(text, TextNormalizer.normalize(text));
    }

    @Test
    void normalizingTwiceChangesNothing() {
        String once = TextNormalizer.normalize("x \n\n\n\ny  \n\n");
        assertEquals(once, TextNormalizer.normalize(once));
    }

    @Test
    void nullStaysNull() {
        assertNull(TextNormalizer.normalize(null));
    }
}
