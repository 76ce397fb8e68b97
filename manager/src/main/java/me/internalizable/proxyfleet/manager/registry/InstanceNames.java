package me.internalizable.proxyfleet.manager.registry;

import me.internalizable.proxyfleet.api.error.ValidationException;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Validation of instance names.
 *
 * <p>A name doubles as a registry key and a directory name, so it is limited
 * to letters, digits, {@code .}, {@code -} and {@code _}. Names starting with
 * a dot are reserved for the registry's staging directories.</p>
 */
public final class InstanceNames {

    public static final int MAX_LENGTH = 64;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1," + MAX_LENGTH + "}$");

    private InstanceNames() {
    }

    /**
     * Check whether a name is acceptable.
     *
     * @param name candidate name
     * @return true if valid
     */
    public static boolean isValid(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches() && !name.startsWith(".");
    }

    /**
     * Validate a name.
     *
     * @param name candidate name
     * @return the same name
     * @throws ValidationException if the name is malformed
     */
    @Nonnull
    public static String validate(String name) {
        if (name == null || name.isEmpty()) {
            throw new ValidationException("Instance name is required");
        }
        if (!isValid(name)) {
            throw new ValidationException("Invalid instance name '" + name + "': must be 1-" + MAX_LENGTH
                    + " characters of letters, digits, '.', '-' or '_' and must not start with '.'");
        }
        return name;
    }

    /**
     * Resolve the directory of an instance below a base directory.
     *
     * @param base data directory
     * @param name instance name
     * @return instance directory
     * @throws ValidationException if the name is malformed or escapes the base
     */
    @Nonnull
    public static Path resolve(@Nonnull Path base, String name) {
        validate(name);
        Path normalizedBase = base.toAbsolutePath().normalize();
        Path resolved = normalizedBase.resolve(name).normalize();
        if (!normalizedBase.equals(resolved.getParent())) {
            throw new ValidationException("Instance name '" + name + "' escapes the data directory");
        }
        return resolved;
    }
}
