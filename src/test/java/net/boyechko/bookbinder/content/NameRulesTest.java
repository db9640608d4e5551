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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class NameRulesTest {

    @ParameterizedTest(name = "rejects \"{0}\"")
    @ValueSource(strings = {"", "   ", " padded", "padded ", "a/b", "file.md", ".hidden", "index"})
    void rejectsUnusableNames(String name) {
        assertThrows(ContentValidationException.class, () -> NameRules.validate(name));
    }

    @ParameterizedTest(name = "accepts \"{0}\"")
    @ValueSource(strings = {"chapter_1", "Preface", "part-two", "indexes"})
    void acceptsPlainNames(String name) {
        assertEquals(name, NameRules.validate(name));
    }

    @Test
    void ignoresIndexLockAndHiddenFiles() {
        assertTrue(NameRules.isIgnored("index.md"));
        assertTrue(NameRules.isIgnored(".#chapter.md"));
        assertTrue(NameRules.isIgnored(".git"));
        assertFalse(NameRules.isIgnored("chapter.md"));
    }
}
