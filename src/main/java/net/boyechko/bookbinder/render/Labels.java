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

import java.util.Locale;
import java.util.function.Function;

/** Parsing of setting values given either as labels ("each text") or constant names. */
final class Labels {

    private Labels() {}

    static <E extends Enum<E>> E parse(Class<E> type, String value, Function<E, String> label) {
        if (value == null) {
            throw new IllegalArgumentException("Missing value for " + type.getSimpleName());
        }
        String wanted = value.strip().toLowerCase(Locale.ROOT).replace('_', ' ');
        for (E constant : type.getEnumConstants()) {
            if (label.apply(constant).equals(wanted)
                    || constant.name().toLowerCase(Locale.ROOT).replace('_', ' ').equals(wanted)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                "Unknown " + type.getSimpleName() + " value: " + value);
    }
}
