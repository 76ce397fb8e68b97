package me.internalizable.proxyfleet.manager.registry;

import me.internalizable.proxyfleet.api.error.PortConflictException;
import me.internalizable.proxyfleet.api.error.ValidationException;
import me.internalizable.proxyfleet.manager.testing.TestRecords;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortAllocatorTest {

    private final PortAllocator allocator = new PortAllocator(1024, 65535);

    @Test
    void rejectsPortsOutsideRange() {
        assertThatThrownBy(() -> allocator.validate(80)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> allocator.validate(65536)).isInstanceOf(ValidationException.class);
        assertThatCode(() -> allocator.validate(1024)).doesNotThrowAnyException();
        assertThatCode(() -> allocator.validate(65535)).doesNotThrowAnyException();
    }

    @Test
    void reportsOwnerOfClaimedPort() {
        List<InstanceRecord> records = List.of(TestRecords.forwardProxy("office", 3128));

        assertThatThrownBy(() -> allocator.reserve(3128, null, null, records))
                .isInstanceOfSatisfying(PortConflictException.class, e -> {
                    assertThat(e.getPort()).isEqualTo(3128);
                    assertThat(e.getOwner()).isEqualTo("office");
                });
    }

    @Test
    void ignoresOwnClaimsOnUpdate() {
        List<InstanceRecord> records = List.of(TestRecords.forwardProxy("office", 3128));

        assertThatCode(() -> allocator.reserve(3128, null, "office", records)).doesNotThrowAnyException();
    }

    @Test
    void coverPortsAreClaimed() {
        InstanceRecord tunnel = TestRecords.tlsTunnel("vpn-front", 8443, "127.0.0.1:1194", "www.example.com");

        assertThat(allocator.claimedPorts(List.of(tunnel))).containsEntry(18443, "vpn-front");
        assertThatThrownBy(() -> allocator.reserve(18443, null, null, List.of(tunnel)))
                .isInstanceOf(PortConflictException.class);
        assertThatThrownBy(() -> allocator.reserve(9443, 18443, null, List.of(tunnel)))
                .isInstanceOf(PortConflictException.class);
    }

    @Test
    void coverPortWrapsBelowForHighPorts() {
        assertThat(PortAllocator.coverPortFor(8443)).isEqualTo(18443);
        assertThat(PortAllocator.coverPortFor(60000)).isEqualTo(50000);
    }
}
