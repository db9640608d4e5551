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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Gzipped tar export of books and subtrees, and import of flat reference collections. */
public final class BookArchive {
    private static final Logger logger = LoggerFactory.getLogger(BookArchive.class);

    private BookArchive() {}

    /**
     * Writes the node's backing files and those of all its descendants, with entry names relative
     * to the node's parent directory. For a book the entries start with the book id.
     */
    public static int export(ContentNode node, OutputStream out) throws IOException {
        Path base = node.location().getParent();
        int count = 0;
        try (TarArchiveOutputStream tar =
                new TarArchiveOutputStream(new GzipCompressorOutputStream(out))) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (ContentNode n : node.subtree()) {
                if (n instanceof ContentContainer container) {
                    addDirectory(tar, entryName(base, container.directory()) + "/");
                }
                addFile(tar, entryName(base, n.backingFile()), Files.readAllBytes(n.backingFile()));
                count++;
            }
            tar.finish();
        }
        logger.info("Exported {} with {} records", describe(node), count);
        return count;
    }

    /**
     * Reads a references collection: the archive must hold only flat {@code .md} files. Nothing
     * is written unless the whole archive is acceptable. Returns the number of files written.
     */
    public static int importReferences(InputStream in, Path referencesDir) throws IOException {
        Map<String, byte[]> files = new LinkedHashMap<>();
        try (TarArchiveInputStream tar =
                new TarArchiveInputStream(new GzipCompressorInputStream(in))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                String name = entry.getName();
                if (name.startsWith("./")) {
                    name = name.substring(2);
                }
                if (entry.isDirectory() || name.contains("/") || name.contains("\\")) {
                    if (entry.isDirectory() && (name.isEmpty() || name.equals("./"))) {
                        continue;
                    }
                    throw new ContentValidationException(
                            "References archive may not contain directories: " + entry.getName());
                }
                if (!name.endsWith(NameRules.EXTENSION) || NameRules.isIgnored(name)) {
                    logger.warn("Skipping non-reference entry {}", name);
                    continue;
                }
                NameRules.validate(name.substring(0, name.length() - NameRules.EXTENSION.length()));
                files.put(name, tar.readAllBytes());
            }
        }

        Files.createDirectories(referencesDir);
        for (Map.Entry<String, byte[]> file : files.entrySet()) {
            Files.write(referencesDir.resolve(file.getKey()), file.getValue());
        }
        logger.info("Imported {} references into {}", files.size(), referencesDir);
        return files.size();
    }

    private static String entryName(Path base, Path file) {
        return base.relativize(file).toString().replace('\\', '/');
    }

    private static void addDirectory(TarArchiveOutputStream tar, String name) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(name);
        tar.putArchiveEntry(entry);
        tar.closeArchiveEntry();
    }

    private static void addFile(TarArchiveOutputStream tar, String name, byte[] data)
            throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(name);
        entry.setSize(data.length);
        tar.putArchiveEntry(entry);
        tar.write(data);
        tar.closeArchiveEntry();
    }

    private static String describe(ContentNode node) {
        return node instanceof Book b ? "book " + b.id() : node.path();
    }

    /** Convenience for callers that want the archive in memory. */
    public static byte[] exportToBytes(ContentNode node) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        export(node, out);
        return out.toByteArray();
    }
}
