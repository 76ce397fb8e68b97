package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.manager.registry.AtomicFiles;
import me.internalizable.proxyfleet.manager.security.ArtifactPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Static site served to clients that connect to a tunnel using its cover domain.
 */
public final class CoverSite {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoverSite.class);

    public static final String INDEX_FILE = "index.html";

    static final String DEFAULT_INDEX = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
                <meta charset="utf-8">
                <title>Welcome</title>
            </head>
            <body>
                <h1>Welcome</h1>
                <p>This site is under construction.</p>
            </body>
            </html>
            """;

    private CoverSite() {
    }

    /**
     * Write the default page unless the directory already has an index.
     * An existing index is never replaced, so operators can publish their own.
     *
     * @param directory cover site directory
     * @param permissions permissions for the directory and page
     * @return true if a page was written
     * @throws IOException if writing fails
     */
    public static boolean ensureIndex(@Nonnull Path directory, @Nonnull ArtifactPermissions permissions)
            throws IOException {
        permissions.createDirectories(directory);
        Path index = directory.resolve(INDEX_FILE);
        if (Files.exists(index)) {
            return false;
        }
        AtomicFiles.writeString(index, DEFAULT_INDEX, ArtifactPermissions.FILE);
        permissions.applyFile(index);
        LOGGER.debug("Wrote default cover page to {}", index);
        return true;
    }
}
