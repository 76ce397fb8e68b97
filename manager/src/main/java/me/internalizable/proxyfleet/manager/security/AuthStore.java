package me.internalizable.proxyfleet.manager.security;

import me.internalizable.proxyfleet.api.error.DuplicateUserException;
import me.internalizable.proxyfleet.api.error.NotFoundException;
import me.internalizable.proxyfleet.api.error.StorageException;
import me.internalizable.proxyfleet.manager.instance.InstanceValidator;
import me.internalizable.proxyfleet.manager.registry.AtomicFiles;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import org.apache.commons.codec.digest.Md5Crypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Basic-auth credentials of forward-proxy instances.
 *
 * <p>Each instance has its own {@code passwd} file of {@code user:hash}
 * lines, sorted by username, with hashes in Apache {@code $apr1$} MD5-crypt
 * format as read by Squid's {@code basic_ncsa_auth} helper. Every operation
 * takes the layout of one instance and touches only that instance's file.
 * Concurrent changes to the same file are serialized; changes to different
 * instances never wait on each other.</p>
 */
public class AuthStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthStore.class);

    private final ArtifactPermissions permissions;
    private final Map<Path, ReentrantLock> fileLocks = new ConcurrentHashMap<>();

    public AuthStore(@Nonnull ArtifactPermissions permissions) {
        this.permissions = Objects.requireNonNull(permissions, "permissions");
    }

    /**
     * Create an empty credential file if the instance has none.
     *
     * @param layout instance layout
     */
    public void ensureFile(@Nonnull InstanceLayout layout) {
        Path file = layout.getCredentialsFile();
        withFileLock(file, () -> {
            if (!Files.exists(file)) {
                write(layout, new TreeMap<>());
            }
            return null;
        });
    }

    /**
     * Add a user.
     *
     * @param layout instance layout
     * @param username username
     * @param password plain-text password
     * @throws DuplicateUserException if the user exists
     */
    public void add(@Nonnull InstanceLayout layout, @Nonnull String username, @Nonnull String password) {
        InstanceValidator.validateUsername(username);
        InstanceValidator.validatePassword(password);

        withFileLock(layout.getCredentialsFile(), () -> {
            TreeMap<String, String> entries = read(layout);
            if (entries.containsKey(username)) {
                throw new DuplicateUserException("User '" + username + "' already exists on instance '"
                        + layout.getName() + "'");
            }
            entries.put(username, Md5Crypt.apr1Crypt(password));
            write(layout, entries);
            return null;
        });
        LOGGER.info("Added user '{}' to instance '{}'", username, layout.getName());
    }

    /**
     * Remove a user.
     *
     * @param layout instance layout
     * @param username username
     * @throws NotFoundException if the user does not exist
     */
    public void remove(@Nonnull InstanceLayout layout, @Nonnull String username) {
        withFileLock(layout.getCredentialsFile(), () -> {
            TreeMap<String, String> entries = read(layout);
            if (entries.remove(username) == null) {
                throw new NotFoundException("User '" + username + "' not found on instance '"
                        + layout.getName() + "'");
            }
            write(layout, entries);
            return null;
        });
        LOGGER.info("Removed user '{}' from instance '{}'", username, layout.getName());
    }

    /**
     * List usernames, sorted. Hashes are never returned.
     *
     * @param layout instance layout
     * @return usernames
     */
    @Nonnull
    public List<String> list(@Nonnull InstanceLayout layout) {
        return withFileLock(layout.getCredentialsFile(), () -> new ArrayList<>(read(layout).keySet()));
    }

    /**
     * Count users.
     *
     * @param layout instance layout
     * @return number of users
     */
    public int count(@Nonnull InstanceLayout layout) {
        return list(layout).size();
    }

    /**
     * Check a password against the stored hash.
     *
     * @param layout instance layout
     * @param username username
     * @param password plain-text password
     * @return true if the user exists and the password matches
     */
    public boolean verify(@Nonnull InstanceLayout layout, @Nonnull String username, @Nonnull String password) {
        String hash = withFileLock(layout.getCredentialsFile(), () -> read(layout).get(username));
        return hash != null && hash.equals(Md5Crypt.apr1Crypt(password, hash));
    }

    /**
     * Drop the lock kept for a deleted instance.
     *
     * @param layout instance layout
     */
    public void forget(@Nonnull InstanceLayout layout) {
        fileLocks.remove(layout.getCredentialsFile());
    }

    private <T> T withFileLock(Path file, Supplier<T> action) {
        ReentrantLock lock = fileLocks.computeIfAbsent(file, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private TreeMap<String, String> read(InstanceLayout layout) {
        TreeMap<String, String> entries = new TreeMap<>();
        List<String> lines;
        try {
            lines = Files.readAllLines(layout.getCredentialsFile(), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return entries;
        } catch (IOException e) {
            throw new StorageException("Failed to read credentials of '" + layout.getName() + "': "
                    + e.getMessage(), e);
        }
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (line.isBlank() || colon <= 0) {
                continue;
            }
            entries.put(line.substring(0, colon), line.substring(colon + 1));
        }
        return entries;
    }

    private void write(InstanceLayout layout, TreeMap<String, String> entries) {
        StringBuilder content = new StringBuilder();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            content.append(entry.getKey()).append(':').append(entry.getValue()).append('\n');
        }
        Path file = layout.getCredentialsFile();
        try {
            AtomicFiles.writeString(file, content.toString(), ArtifactPermissions.FILE);
            permissions.applyFile(file);
        } catch (IOException e) {
            throw new StorageException("Failed to write credentials of '" + layout.getName() + "': "
                    + e.getMessage(), e);
        }
    }
}
