package me.internalizable.proxyfleet.manager.security;

import me.internalizable.proxyfleet.manager.registry.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.nio.file.attribute.UserPrincipalNotFoundException;
import java.util.Set;

/**
 * Permissions of per-instance artifacts.
 *
 * <p>Directories are {@code rwxr-x---} and files {@code rw-r-----}: the
 * manager owns them, the daemon's group may read them, other users (and so
 * other instances' daemons running under other accounts) get nothing. When a
 * daemon group is configured it is assigned best-effort; this only succeeds
 * when the manager runs as root or is itself a member of the group.</p>
 */
public class ArtifactPermissions {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactPermissions.class);

    public static final Set<PosixFilePermission> DIRECTORY = PosixFilePermissions.fromString("rwxr-x---");
    public static final Set<PosixFilePermission> FILE = PosixFilePermissions.fromString("rw-r-----");

    private final String daemonGroup;
    private volatile boolean groupWarningLogged = false;

    /**
     * Create a permission policy.
     *
     * @param daemonGroup group of the daemon's runtime user, or null to keep the manager's group
     */
    public ArtifactPermissions(@Nullable String daemonGroup) {
        this.daemonGroup = daemonGroup == null || daemonGroup.isBlank() ? null : daemonGroup;
    }

    /**
     * Create a directory (and parents) with directory permissions.
     *
     * @param directory directory to create
     * @throws IOException if creation fails
     */
    public void createDirectories(@Nonnull Path directory) throws IOException {
        Files.createDirectories(directory);
        applyDirectory(directory);
    }

    /**
     * Apply directory permissions to an existing directory.
     *
     * @param directory the directory
     * @throws IOException if permissions cannot be set
     */
    public void applyDirectory(@Nonnull Path directory) throws IOException {
        if (AtomicFiles.isPosix()) {
            Files.setPosixFilePermissions(directory, DIRECTORY);
        }
        assignGroup(directory);
    }

    /**
     * Apply file permissions to an existing file.
     *
     * @param file the file
     * @throws IOException if permissions cannot be set
     */
    public void applyFile(@Nonnull Path file) throws IOException {
        if (AtomicFiles.isPosix()) {
            Files.setPosixFilePermissions(file, FILE);
        }
        assignGroup(file);
    }

    /**
     * Check whether a directory can be modified by any user.
     *
     * @param directory the directory
     * @return true if others have write permission
     * @throws IOException if attributes cannot be read
     */
    public static boolean isWorldWritable(@Nonnull Path directory) throws IOException {
        if (!AtomicFiles.isPosix() || !Files.exists(directory)) {
            return false;
        }
        return Files.getPosixFilePermissions(directory).contains(PosixFilePermission.OTHERS_WRITE);
    }

    private void assignGroup(Path path) {
        if (daemonGroup == null || !AtomicFiles.isPosix()) {
            return;
        }
        try {
            GroupPrincipal group = FileSystems.getDefault().getUserPrincipalLookupService()
                    .lookupPrincipalByGroupName(daemonGroup);
            PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
            if (!group.equals(view.readAttributes().group())) {
                view.setGroup(group);
            }
        } catch (UserPrincipalNotFoundException e) {
            if (!groupWarningLogged) {
                groupWarningLogged = true;
                LOGGER.warn("Daemon group '{}' does not exist; artifacts keep the manager's group", daemonGroup);
            }
        } catch (IOException e) {
            LOGGER.debug("Could not assign group '{}' to {}: {}", daemonGroup, path, e.getMessage());
        }
    }

    @Nullable
    public String getDaemonGroup() {
        return daemonGroup;
    }
}
