package me.internalizable.proxyfleet.manager.registry;

import me.internalizable.proxyfleet.api.InstanceStatus;
import me.internalizable.proxyfleet.api.ProxyType;
import me.internalizable.proxyfleet.api.error.NameConflictException;
import me.internalizable.proxyfleet.api.error.NotFoundException;
import me.internalizable.proxyfleet.api.error.PortConflictException;
import me.internalizable.proxyfleet.manager.security.ArtifactPermissions;
import me.internalizable.proxyfleet.manager.testing.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstanceRegistryTest {

    @TempDir
    Path tempDir;

    private InstanceRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        registry = new InstanceRegistry(tempDir.resolve("data"), new PortAllocator(1024, 65535),
                new ArtifactPermissions(null));
        registry.initialize();
    }

    @Test
    void createThenRead() {
        registry.create(TestRecords.forwardProxy("office", 3128));

        InstanceRecord stored = registry.require("office");
        assertThat(stored.proxyType()).isEqualTo(ProxyType.FORWARD_PROXY);
        assertThat(stored.port()).isEqualTo(3128);
        assertThat(registry.exists("office")).isTrue();
        assertThat(Files.exists(registry.layout("office").getRecordFile())).isTrue();
    }

    @Test
    void recordIsWrittenAsSnakeCaseJson() throws Exception {
        registry.create(TestRecords.tlsTunnel("vpn-front", 8443, "127.0.0.1:1194", "www.example.com"));

        String json = Files.readString(registry.layout("vpn-front").getRecordFile(), StandardCharsets.UTF_8);
        assertThat(json)
                .contains("\"proxy_type\" : \"tls_tunnel\"")
                .contains("\"forward_address\" : \"127.0.0.1:1194\"")
                .contains("\"desired_state\" : \"stopped\"");
    }

    @Test
    void duplicateNameIsRejected() {
        registry.create(TestRecords.forwardProxy("office", 3128));

        assertThatThrownBy(() -> registry.create(TestRecords.forwardProxy("office", 3129)))
                .isInstanceOf(NameConflictException.class);
    }

    @Test
    void duplicatePortIsRejected() {
        registry.create(TestRecords.forwardProxy("office", 3128));

        assertThatThrownBy(() -> registry.create(TestRecords.forwardProxy("branch", 3128)))
                .isInstanceOf(PortConflictException.class)
                .hasMessageContaining("office");
        assertThat(registry.exists("branch")).isFalse();
    }

    @Test
    void concurrentCreatesOnSamePortLeaveOneWinner() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<InstanceRecord>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String name = "proxy-" + i;
                Callable<InstanceRecord> task = () -> {
                    go.await();
                    return registry.create(TestRecords.forwardProxy(name, 4000));
                };
                futures.add(pool.submit(task));
            }
            go.countDown();

            int succeeded = 0;
            int conflicts = 0;
            for (Future<InstanceRecord> future : futures) {
                try {
                    future.get();
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(PortConflictException.class);
                    conflicts++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(conflicts).isEqualTo(contenders - 1);
            assertThat(registry.list()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void updateRewritesRecord() {
        registry.create(TestRecords.forwardProxy("office", 3128));

        registry.update("office", r -> r.withHttpsEnabled(true).withStatus(InstanceStatus.ERROR, "boom"));

        InstanceRecord stored = registry.require("office");
        assertThat(stored.httpsEnabled()).isTrue();
        assertThat(stored.status()).isEqualTo(InstanceStatus.ERROR);
        assertThat(stored.statusReason()).isEqualTo("boom");
        assertThat(stored.updatedAt()).isNotNull();
    }

    @Test
    void updateToClaimedPortIsRejected() {
        registry.create(TestRecords.forwardProxy("office", 3128));
        registry.create(TestRecords.forwardProxy("branch", 3129));

        assertThatThrownBy(() -> registry.update("branch", r -> r.withPort(3128, null)))
                .isInstanceOf(PortConflictException.class);
        assertThat(registry.require("branch").port()).isEqualTo(3129);
    }

    @Test
    void deleteRemovesDirectory() {
        registry.create(TestRecords.forwardProxy("office", 3128));
        Path directory = registry.layout("office").getDirectory();

        registry.delete("office");

        assertThat(Files.exists(directory)).isFalse();
        assertThat(registry.get("office")).isNull();
        assertThatThrownBy(() -> registry.require("office")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.delete("office")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void listIsSortedAndSkipsUnreadableRecords() throws Exception {
        registry.create(TestRecords.forwardProxy("zulu", 3130));
        registry.create(TestRecords.forwardProxy("alpha", 3131));
        Path broken = registry.getDataDirectory().resolve("broken");
        Files.createDirectories(broken);
        Files.writeString(broken.resolve(InstanceLayout.RECORD_FILE), "{not json");

        assertThat(registry.list()).extracting(InstanceRecord::name).containsExactly("alpha", "zulu");
    }

    @Test
    void initializeRemovesInterruptedOperations() throws Exception {
        Path leftover = registry.getDataDirectory().resolve(".creating-office-1234");
        Files.createDirectories(leftover);
        Files.writeString(leftover.resolve(InstanceLayout.RECORD_FILE), "{}");

        registry.initialize();

        assertThat(Files.exists(leftover)).isFalse();
    }

    @Test
    void readsLegacyRecords() throws Exception {
        Path directory = registry.getDataDirectory().resolve("legacy");
        Files.createDirectories(directory);
        Files.writeString(directory.resolve(InstanceLayout.RECORD_FILE), """
                {
                  "name": "legacy",
                  "proxy_type": "squid",
                  "port": 3200,
                  "https_enabled": false,
                  "dpi_prevention": true,
                  "status": "running",
                  "created_at": "2024-01-01T00:00:00Z"
                }
                """);

        InstanceRecord record = registry.require("legacy");
        assertThat(record.proxyType()).isEqualTo(ProxyType.FORWARD_PROXY);
        assertThat(record.dpiEvasionEnabled()).isTrue();
        assertThat(record.desiredState().toString()).isEqualTo("running");
    }
}
