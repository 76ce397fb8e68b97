package me.internalizable.proxyfleet.manager.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Durable file writes.
 *
 * <p>Every write goes to a temporary file in the target's directory, is
 * forced to disk and then renamed over the target, so a reader sees either
 * the old content or the new content and never a partial file.</p>
 */
public final class AtomicFiles {

    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicFiles.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private AtomicFiles() {
    }

    /**
     * Check whether the default file system supports POSIX permissions.
     *
     * @return true on POSIX systems
     */
    public static boolean isPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }

    /**
     * Atomically replace a file with UTF-8 text.
     *
     * @param target file to write
     * @param content text
     * @param permissions permissions for the new file, or null for the default
     * @throws IOException if writing fails
     */
    public static void writeString(@Nonnull Path target, @Nonnull String content,
                                   @Nullable Set<PosixFilePermission> permissions) throws IOException {
        write(target, content.getBytes(StandardCharsets.UTF_8), permissions);
    }

    /**
     * Atomically replace a file.
     *
     * @param target file to write
     * @param data bytes
     * @param permissions permissions for the new file, or null for the default
     * @throws IOException if writing fails
     */
    public static void write(@Nonnull Path target, @Nonnull byte[] data,
                             @Nullable Set<PosixFilePermission> permissions) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        Path temp = permissions != null && isPosix()
                ? Files.createTempFile(directory, "." + target.getFileName(), TEMP_SUFFIX,
                        PosixFilePermissions.asFileAttribute(permissions))
                : Files.createTempFile(directory, "." + target.getFileName(), TEMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            if (permissions != null && isPosix()) {
                // createTempFile is subject to the umask
                Files.setPosixFilePermissions(temp, permissions);
            }
            move(temp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        LOGGER.debug("Wrote {} ({} bytes)", target, data.length);
    }

    /**
     * Rename a file or directory, atomically where the file system allows it.
     *
     * @param source existing path
     * @param target new path, replaced if it exists and is a file
     * @throws IOException if the move fails
     */
    public static void move(@Nonnull Path source, @Nonnull Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Atomically rename a directory. The target must not exist.
     *
     * @param source existing directory
     * @param target new name
     * @throws IOException if the rename fails
     */
    public static void moveDirectory(@Nonnull Path source, @Nonnull Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Recursively delete a directory tree. Missing paths are ignored.
     *
     * @param directory root of the tree
     * @throws IOException if a file cannot be deleted
     */
    public static void deleteRecursively(@Nonnull Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
