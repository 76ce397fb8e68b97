package me.internalizable.proxyfleet.manager.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.proxyfleet.api.error.NameConflictException;
import me.internalizable.proxyfleet.api.error.NotFoundException;
import me.internalizable.proxyfleet.api.error.StorageException;
import me.internalizable.proxyfleet.manager.security.ArtifactPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Durable store of instance records.
 *
 * <p>Each instance is a directory below the data directory holding its
 * {@code instance.json}. Nothing is cached: every read goes to disk, so the
 * registry can never disagree with what other tooling sees.</p>
 *
 * <p>Creation stages the new directory under a {@code .creating-} name and
 * renames it into place, so an instance appears together with its record or
 * not at all. Deletion renames the directory to a {@code .deleting-} name
 * before removing it. Staging directories left behind by a crash are removed
 * by {@link #initialize()}.</p>
 *
 * <p>Claims on names and ports are serialized by one lock shared by
 * {@link #create} and port-changing {@link #update}s. All other operations
 * rely on the caller holding the instance's own lock.</p>
 */
public class InstanceRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceRegistry.class);

    private static final String CREATING_PREFIX = ".creating-";
    private static final String DELETING_PREFIX = ".deleting-";

    private final Path dataDirectory;
    private final PortAllocator portAllocator;
    private final ArtifactPermissions permissions;
    private final ObjectMapper mapper = RecordMapper.create();
    private final ReentrantLock claimLock = new ReentrantLock();

    /**
     * Create a registry.
     *
     * @param dataDirectory directory holding one subdirectory per instance
     * @param portAllocator port validation
     * @param permissions permissions applied to instance directories
     */
    public InstanceRegistry(
            @Nonnull Path dataDirectory,
            @Nonnull PortAllocator portAllocator,
            @Nonnull ArtifactPermissions permissions) {
        this.dataDirectory = Objects.requireNonNull(dataDirectory, "dataDirectory").toAbsolutePath().normalize();
        this.portAllocator = Objects.requireNonNull(portAllocator, "portAllocator");
        this.permissions = Objects.requireNonNull(permissions, "permissions");
    }

    /**
     * Create the data directory and remove leftovers of interrupted creates and deletes.
     *
     * @throws IOException if the data directory cannot be created
     */
    public void initialize() throws IOException {
        Files.createDirectories(dataDirectory);
        cleanupLeftovers();
        LOGGER.info("Instance registry initialized at {}", dataDirectory);
    }

    private void cleanupLeftovers() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDirectory)) {
            for (Path entry : stream) {
                String fileName = entry.getFileName().toString();
                if (Files.isDirectory(entry)
                        && (fileName.startsWith(CREATING_PREFIX) || fileName.startsWith(DELETING_PREFIX))) {
                    LOGGER.info("Cleaning up leftover directory: {}", fileName);
                    AtomicFiles.deleteRecursively(entry);
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to clean up leftover directories: {}", e.getMessage());
        }
    }

    // ==================== Create ====================

    /**
     * Store a new record and create the instance directory.
     *
     * @param record the record
     * @return the stored record
     * @throws NameConflictException if the name is taken
     * @throws me.internalizable.proxyfleet.api.error.PortConflictException if a port is taken
     * @throws StorageException if writing fails
     */
    @Nonnull
    public InstanceRecord create(@Nonnull InstanceRecord record) {
        Objects.requireNonNull(record, "record");
        InstanceLayout layout = layout(record.name());
        portAllocator.validate(record.port());

        claimLock.lock();
        try {
            if (Files.exists(layout.getDirectory())) {
                throw new NameConflictException("Instance '" + record.name() + "' already exists");
            }
            portAllocator.reserve(record.port(), record.coverPort(), null, list());

            Path staging = dataDirectory.resolve(CREATING_PREFIX + record.name() + "-" + shortId());
            try {
                permissions.createDirectories(staging);
                writeRecord(staging.resolve(InstanceLayout.RECORD_FILE), record);
                AtomicFiles.moveDirectory(staging, layout.getDirectory());
            } catch (IOException e) {
                discard(staging);
                throw new StorageException("Failed to create instance '" + record.name() + "': "
                        + e.getMessage(), e);
            }

            LOGGER.info("Registered instance '{}' ({}, port {})", record.name(), record.proxyType(), record.port());
            return record;
        } finally {
            claimLock.unlock();
        }
    }

    // ==================== Read ====================

    /**
     * Get a record.
     *
     * @param name instance name
     * @return the record, or null if no such instance exists
     * @throws StorageException if the record exists but cannot be read
     */
    @Nullable
    public InstanceRecord get(@Nonnull String name) {
        InstanceLayout layout = layout(name);
        try {
            return readRecord(layout.getRecordFile());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StorageException("Failed to read record of instance '" + name + "': " + e.getMessage(), e);
        }
    }

    /**
     * Get a record that must exist.
     *
     * @param name instance name
     * @return the record
     * @throws NotFoundException if no such instance exists
     */
    @Nonnull
    public InstanceRecord require(@Nonnull String name) {
        InstanceRecord record = get(name);
        if (record == null) {
            throw new NotFoundException("Instance '" + name + "' not found");
        }
        return record;
    }

    /**
     * Check whether an instance exists.
     *
     * @param name instance name
     * @return true if the instance directory exists
     */
    public boolean exists(@Nonnull String name) {
        return InstanceNames.isValid(name) && Files.isDirectory(layout(name).getDirectory());
    }

    /**
     * Read every record, sorted by name. Unreadable records are logged and skipped.
     *
     * @return the records
     */
    @Nonnull
    public List<InstanceRecord> list() {
        List<InstanceRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDirectory)) {
            for (Path entry : stream) {
                String fileName = entry.getFileName().toString();
                if (!Files.isDirectory(entry) || !InstanceNames.isValid(fileName)) {
                    continue;
                }
                Path recordFile = entry.resolve(InstanceLayout.RECORD_FILE);
                if (!Files.exists(recordFile)) {
                    continue;
                }
                try {
                    records.add(readRecord(recordFile));
                } catch (IOException | RuntimeException e) {
                    LOGGER.error("Failed to read record of instance '{}': {}", fileName, e.getMessage());
                }
            }
        } catch (NoSuchFileException e) {
            return records;
        } catch (IOException e) {
            throw new StorageException("Failed to scan data directory: " + e.getMessage(), e);
        }
        records.sort(Comparator.comparing(InstanceRecord::name));
        return records;
    }

    // ==================== Update ====================

    /**
     * Rewrite a record.
     *
     * <p>If the mutation changes the listening or cover port, the new ports
     * are reserved under the claim lock before the record is written.</p>
     *
     * @param name instance name
     * @param mutation function from the current record to the new one
     * @return the stored record
     * @throws NotFoundException if no such instance exists
     */
    @Nonnull
    public InstanceRecord update(@Nonnull String name, @Nonnull UnaryOperator<InstanceRecord> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        InstanceRecord current = require(name);
        InstanceRecord updated = Objects.requireNonNull(mutation.apply(current), "updated record");
        if (!updated.name().equals(current.name())) {
            throw new IllegalArgumentException("Instances cannot be renamed");
        }

        boolean portsChanged = updated.port() != current.port()
                || !Objects.equals(updated.coverPort(), current.coverPort());
        if (portsChanged) {
            claimLock.lock();
            try {
                portAllocator.reserve(updated.port(), updated.coverPort(), name, list());
                store(updated);
            } finally {
                claimLock.unlock();
            }
        } else {
            store(updated);
        }
        return updated;
    }

    private void store(InstanceRecord record) {
        InstanceLayout layout = layout(record.name());
        if (!Files.isDirectory(layout.getDirectory())) {
            throw new NotFoundException("Instance '" + record.name() + "' not found");
        }
        try {
            writeRecord(layout.getRecordFile(), record);
        } catch (IOException e) {
            throw new StorageException("Failed to write record of instance '" + record.name() + "': "
                    + e.getMessage(), e);
        }
        LOGGER.debug("Stored record of '{}' (desired={}, status={})",
                record.name(), record.desiredState(), record.status());
    }

    // ==================== Delete ====================

    /**
     * Remove an instance directory with its record and every artifact in it.
     *
     * <p>The directory is first renamed out of the way, so the instance
     * disappears atomically even if removing its files fails halfway.</p>
     *
     * @param name instance name
     * @throws NotFoundException if no such instance exists
     * @throws StorageException if the directory cannot be removed
     */
    public void delete(@Nonnull String name) {
        InstanceLayout layout = layout(name);
        if (!Files.isDirectory(layout.getDirectory())) {
            throw new NotFoundException("Instance '" + name + "' not found");
        }

        Path tombstone = dataDirectory.resolve(DELETING_PREFIX + name + "-" + shortId());
        try {
            AtomicFiles.moveDirectory(layout.getDirectory(), tombstone);
            AtomicFiles.deleteRecursively(tombstone);
        } catch (IOException e) {
            throw new StorageException("Failed to delete instance '" + name + "': " + e.getMessage(), e);
        }
        LOGGER.info("Removed instance '{}'", name);
    }

    // ==================== Helpers ====================

    /**
     * Resolve the layout of an instance.
     *
     * @param name instance name
     * @return layout
     * @throws me.internalizable.proxyfleet.api.error.ValidationException if the name is malformed
     */
    @Nonnull
    public InstanceLayout layout(@Nonnull String name) {
        return InstanceLayout.of(dataDirectory, name);
    }

    @Nonnull
    public Path getDataDirectory() {
        return dataDirectory;
    }

    @Nonnull
    public PortAllocator getPortAllocator() {
        return portAllocator;
    }

    private InstanceRecord readRecord(Path recordFile) throws IOException {
        byte[] data = Files.readAllBytes(recordFile);
        InstanceRecord record = mapper.readValue(data, InstanceRecord.class);
        String directoryName = recordFile.getParent().getFileName().toString();
        if (!directoryName.equals(record.name())) {
            throw new IOException("Record name '" + record.name() + "' does not match directory '"
                    + directoryName + "'");
        }
        return record;
    }

    private void writeRecord(Path recordFile, InstanceRecord record) throws IOException {
        byte[] data;
        try {
            data = mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IOException("Cannot serialize record of '" + record.name() + "'", e);
        }
        AtomicFiles.write(recordFile, data, ArtifactPermissions.FILE);
        permissions.applyFile(recordFile);
    }

    private void discard(Path staging) {
        try {
            AtomicFiles.deleteRecursively(staging);
        } catch (IOException e) {
            LOGGER.warn("Failed to remove staging directory {}: {}", staging, e.getMessage());
        }
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
