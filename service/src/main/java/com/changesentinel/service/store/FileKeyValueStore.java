package com.changesentinel.service.store;

import com.changesentinel.core.error.PersistenceException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import java.util.regex.Pattern;

public class FileKeyValueStore implements KeyValueStore {
    private static final Logger LOGGER = Logger.getLogger(FileKeyValueStore.class.getName());
    private static final Pattern KEY = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final FileMover mover;
    private final ReentrantLock lock = new ReentrantLock();

    public FileKeyValueStore(Path directory) {
        this(directory, FileKeyValueStore::atomicMove);
    }

    FileKeyValueStore(Path directory, FileMover mover) {
        this.directory = directory;
        this.mover = mover;
        try {
            Files.createDirectories(directory);
            removeStrayTempFiles();
        } catch (IOException e) {
            throw new PersistenceException("Failed opening state directory " + directory, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = fileFor(key);
        lock.lock();
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new PersistenceException("Failed reading " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, byte[] value) {
        Path file = fileFor(key);
        Path temp = directory.resolve(key + TEMP_SUFFIX);
        lock.lock();
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(value);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            mover.move(temp, file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Failed writing " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        Path file = fileFor(key);
        lock.lock();
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PersistenceException("Failed deleting " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private Path fileFor(String key) {
        if (key == null || !KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid store key: " + key);
        }
        return directory.resolve(key + SUFFIX);
    }

    private void removeStrayTempFiles() throws IOException {
        try (DirectoryStream<Path> strays = Files.newDirectoryStream(directory, "*" + TEMP_SUFFIX)) {
            for (Path stray : strays) {
                LOGGER.warning("Removing incomplete write " + stray);
                Files.deleteIfExists(stray);
            }
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupError) {
            LOGGER.warning("Could not remove " + temp + ": " + cleanupError.getMessage());
        }
    }

    private static void atomicMove(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.warning("Atomic rename unsupported for " + target + "; falling back to replace");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    interface FileMover {
        void move(Path source, Path target) throws IOException;
    }
}
