package me.internalizable.proxyfleet.manager.registry;

import me.internalizable.proxyfleet.api.error.PortConflictException;
import me.internalizable.proxyfleet.api.error.ValidationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Validates requested ports against the legal range and the ports already
 * claimed by other instances.
 *
 * <p>A record claims its listening port and, for TLS tunnels with a cover
 * site, the loopback port of that site. The allocator holds no state of its
 * own; callers pass the current records while holding the registry's claim
 * lock, so the check and the commit cannot interleave with another claim.</p>
 */
public class PortAllocator {

    /**
     * Distance between a tunnel's listening port and its cover site port.
     */
    public static final int COVER_PORT_OFFSET = 10000;

    private final int rangeStart;
    private final int rangeEnd;

    /**
     * Create a port allocator.
     *
     * @param rangeStart lowest legal port
     * @param rangeEnd highest legal port
     */
    public PortAllocator(int rangeStart, int rangeEnd) {
        if (rangeStart < 1 || rangeEnd > 65535 || rangeStart > rangeEnd) {
            throw new IllegalArgumentException("Invalid port range: " + rangeStart + "-" + rangeEnd);
        }
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    /**
     * Check that a port lies in the legal range.
     *
     * @param port port number
     * @throws ValidationException if out of range
     */
    public void validate(int port) {
        if (port < rangeStart || port > rangeEnd) {
            throw new ValidationException("Invalid port " + port + ": must be between "
                    + rangeStart + " and " + rangeEnd);
        }
    }

    /**
     * Reserve a port for an instance.
     *
     * @param port requested port
     * @param coverPort cover site port the instance also needs, or null
     * @param excluding name of the instance being updated, whose own claims are ignored
     * @param records every current record
     * @throws ValidationException if the port is out of range
     * @throws PortConflictException if another instance claims either port
     */
    public void reserve(int port, @Nullable Integer coverPort, @Nullable String excluding,
                        @Nonnull Collection<InstanceRecord> records) {
        validate(port);

        Map<Integer, String> claimed = claimedPorts(records);
        checkFree(port, excluding, claimed);
        if (coverPort != null) {
            checkFree(coverPort, excluding, claimed);
        }
    }

    private void checkFree(int port, @Nullable String excluding, Map<Integer, String> claimed) {
        String owner = claimed.get(port);
        if (owner != null && !owner.equals(excluding)) {
            throw new PortConflictException(port, owner);
        }
    }

    /**
     * Map every claimed port to its owning instance.
     *
     * @param records current records
     * @return port to instance name
     */
    @Nonnull
    public Map<Integer, String> claimedPorts(@Nonnull Collection<InstanceRecord> records) {
        Map<Integer, String> claimed = new HashMap<>();
        for (InstanceRecord record : records) {
            claimed.put(record.port(), record.name());
            if (record.coverPort() != null) {
                claimed.put(record.coverPort(), record.name());
            }
        }
        return claimed;
    }

    /**
     * Derive the loopback port of a tunnel's cover site.
     *
     * @param port listening port
     * @return cover site port
     */
    public static int coverPortFor(int port) {
        int candidate = port + COVER_PORT_OFFSET;
        return candidate <= 65535 ? candidate : port - COVER_PORT_OFFSET;
    }

    public int getRangeStart() {
        return rangeStart;
    }

    public int getRangeEnd() {
        return rangeEnd;
    }
}
