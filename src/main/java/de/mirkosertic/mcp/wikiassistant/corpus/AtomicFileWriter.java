package de.mirkosertic.mcp.wikiassistant.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Replaces files by writing a sibling temporary file, forcing it to disk and renaming it over
 * the target. A crash at any point leaves either the previous or the new content in place,
 * never a partially written file.
 */
public class AtomicFileWriter {

    private static final Logger logger = LoggerFactory.getLogger(AtomicFileWriter.class);

    static final String TEMP_SUFFIX = ".tmp";

    /**
     * Atomically replace {@code target} with {@code content}.
     *
     * @throws IOException if the temporary file cannot be written or moved into place; the
     *                     previous content of {@code target} is left untouched in that case
     */
    public void write(final Path target, final byte[] content) throws IOException {
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }

        final Path temp = tempFileFor(target);
        try (final FileChannel channel = FileChannel.open(temp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            final ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }

        moveIntoPlace(temp, target);
    }

    /**
     * Temporary file used while replacing {@code target}.
     */
    public static Path tempFileFor(final Path target) {
        return target.resolveSibling(target.getFileName().toString() + TEMP_SUFFIX);
    }

    void moveIntoPlace(final Path temp, final Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
