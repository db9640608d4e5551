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

import java.util.List;
import org.junit.jupiter.api.Test;

public class StatusTest {

    @Test
    void parsesLabelsCaseInsensitively() {
        assertEquals(Status.REVISED, Status.parse("Revised"));
        assertEquals(Status.PROOFS, Status.parse(" proofs "));
    }

    @Test
    void unknownOrMissingIsLowest() {
        assertEquals(Status.LOWEST, Status.parse("polished"));
        assertEquals(Status.LOWEST, Status.parse(null));
    }

    @Test
    void minimumIsTheLeastFinished() {
        assertEquals(
                Status.DRAFT, Status.min(List.of(Status.FINAL, Status.DRAFT, Status.DONE), null));
        assertEquals(Status.DONE, Status.min(List.of(), Status.DONE));
    }

    @Test
    void labelIsLowerCaseName() {
        assertEquals("incomplete", Status.INCOMPLETE.label());
    }
}
