package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.manager.security.ArtifactPermissions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CoverSiteTest {

    @TempDir
    Path tempDir;

    @Test
    void writesDefaultPageOnce() throws Exception {
        Path site = tempDir.resolve("cover_site");

        assertThat(CoverSite.ensureIndex(site, new ArtifactPermissions(null))).isTrue();
        assertThat(Files.readString(site.resolve(CoverSite.INDEX_FILE))).contains("<title>Welcome</title>");
        assertThat(CoverSite.ensureIndex(site, new ArtifactPermissions(null))).isFalse();
    }

    @Test
    void keepsOperatorPage() throws Exception {
        Path site = tempDir.resolve("cover_site");
        Files.createDirectories(site);
        Files.writeString(site.resolve(CoverSite.INDEX_FILE), "<p>custom</p>");

        CoverSite.ensureIndex(site, new ArtifactPermissions(null));

        assertThat(Files.readString(site.resolve(CoverSite.INDEX_FILE))).isEqualTo("<p>custom</p>");
    }
}
