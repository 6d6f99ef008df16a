// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sift.core.error.SegmentStoreException;

/**
 * {@link SegmentStore} over a local directory.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved into place
 * atomically, so a reader either sees no file or the complete segment. I/O failures are
 * reported as retryable; a duplicate write or a missing segment are not.
 */
public final class FileSegmentStore implements SegmentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSegmentStore.class);

    private final Path directory;

    /**
     * @param directory segment directory; created if missing
     * @throws SegmentStoreException if the directory cannot be created
     */
    public FileSegmentStore(final Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new SegmentStoreException("Cannot create segment directory " + directory, false, e);
        }
    }

    public Path directory() {
        return directory;
    }

    @Override
    public boolean exists(final SegmentId id) {
        return Files.isRegularFile(resolve(id));
    }

    @Override
    public void write(final SegmentId id, final byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        final Path target = resolve(id);
        if (Files.exists(target)) {
            throw new SegmentStoreException("Segment " + id + " already exists", false);
        }
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + id.fileName(), ".tmp");
            Files.write(temp, payload);
            moveIntoPlace(temp, target);
            temp = null;
        } catch (FileAlreadyExistsException e) {
            throw new SegmentStoreException("Segment " + id + " already exists", false, e);
        } catch (IOException e) {
            throw new SegmentStoreException("Failed to write segment " + id + ": " + e.getMessage(), true, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public byte[] open(final SegmentId id) {
        try {
            return Files.readAllBytes(resolve(id));
        } catch (NoSuchFileException e) {
            throw new SegmentStoreException("Segment " + id + " does not exist", false, e);
        } catch (IOException e) {
            throw new SegmentStoreException("Failed to read segment " + id + ": " + e.getMessage(), true, e);
        }
    }

    private Path resolve(final SegmentId id) {
        return directory.resolve(id.fileName());
    }

    private static void moveIntoPlace(final Path temp, final Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported in {}, falling back to plain move", target.getParent());
            Files.move(temp, target);
        }
    }

    private static void deleteQuietly(final Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary segment file {}", temp, e);
        }
    }
}
