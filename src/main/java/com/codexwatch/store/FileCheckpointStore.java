package com.codexwatch.store;

import com.codexwatch.error.PersistenceException;
import com.codexwatch.model.Checkpoint;
import com.codexwatch.model.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Local file checkpoint store.
 *
 * <p>Saves go through a temporary file in the target's directory which is
 * synced to disk and then renamed over the target, so {@link #load()} only
 * ever sees a complete old or a complete new record.
 */
public final class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    /**
     * Final step of a save: replace {@code target} with {@code source}.
     */
    @FunctionalInterface
    interface FileMover {
        void move(Path source, Path target) throws IOException;
    }

    private final Path path;
    private final CheckpointCodec codec;
    private final FileMover mover;

    public FileCheckpointStore(Path path) {
        this(path, new CheckpointCodec(), FileCheckpointStore::atomicMove);
    }

    FileCheckpointStore(Path path, CheckpointCodec codec, FileMover mover) {
        this.path = path.toAbsolutePath();
        this.codec = codec;
        this.mover = mover;
    }

    @Override
    public Checkpoint load() {
        byte[] payload;
        try {
            payload = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.info("No checkpoint at {}, starting from an empty one", path);
            return Checkpoint.empty();
        } catch (IOException e) {
            throw new PersistenceException("Failed to read checkpoint file: " + path, e);
        }
        return codec.decode(payload, path.toString());
    }

    @Override
    public void save(Checkpoint checkpoint) {
        byte[] payload = codec.encode(checkpoint);
        Path directory = path.getParent();
        Path temp = null;

        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + path.getFileName() + ".", ".tmp");

            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(payload);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            mover.move(temp, path);
            log.debug("Checkpoint saved to {}", path);

        } catch (IOException e) {
            PersistenceException failure =
                    new PersistenceException("Failed to save checkpoint file atomically: " + path, e);
            removeTemp(temp, failure);
            throw failure;
        }
    }

    private static void removeTemp(Path temp, PersistenceException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            log.warn("Could not remove temporary checkpoint file {}", temp, cleanup);
            failure.addSuppressed(cleanup);
        }
    }

    private static void atomicMove(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
