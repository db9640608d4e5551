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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * SHA-256 digest of a node: its metadata without the digest field, its content, and for
 * containers the digests of the children in order.
 */
final class DigestCalculator {
    private static final String ALGORITHM = "SHA-256";

    private DigestCalculator() {}

    static String digest(ContentNode node) {
        node.refreshDerived();
        MessageDigest md = newDigest();

        Map<String, Object> metadata = Frontmatter.deepCopy(node.metadata());
        metadata.remove(ContentNode.DIGEST);
        md.update(Frontmatter.canonicalDump(metadata).getBytes(StandardCharsets.UTF_8));
        md.update(node.content().getBytes(StandardCharsets.UTF_8));

        if (node instanceof ContentContainer container) {
            for (ContentNode child : container.children()) {
                md.update(digest(child).getBytes(StandardCharsets.UTF_8));
            }
        }
        return HexFormat.of().formatHex(md.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
