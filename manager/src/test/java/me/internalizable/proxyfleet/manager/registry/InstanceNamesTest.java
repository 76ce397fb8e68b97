package me.internalizable.proxyfleet.manager.registry;

import me.internalizable.proxyfleet.api.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstanceNamesTest {

    @Test
    void acceptsSimpleNames() {
        assertThat(InstanceNames.isValid("office")).isTrue();
        assertThat(InstanceNames.isValid("vpn-front_2.eu")).isTrue();
        assertThat(InstanceNames.isValid("a".repeat(64))).isTrue();
    }

    @Test
    void rejectsMalformedNames() {
        assertThat(InstanceNames.isValid(null)).isFalse();
        assertThat(InstanceNames.isValid("")).isFalse();
        assertThat(InstanceNames.isValid("a".repeat(65))).isFalse();
        assertThat(InstanceNames.isValid("has space")).isFalse();
        assertThat(InstanceNames.isValid("../etc")).isFalse();
        assertThat(InstanceNames.isValid(".hidden")).isFalse();
        assertThat(InstanceNames.isValid("slash/name")).isFalse();
    }

    @Test
    void validateReportsTheName() {
        assertThatThrownBy(() -> InstanceNames.validate("bad name"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("bad name");
        assertThatThrownBy(() -> InstanceNames.validate(""))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("required");
    }

    @Test
    void resolveStaysInsideBase() {
        Path base = Paths.get("/var/lib/proxyfleet");

        assertThat(InstanceNames.resolve(base, "office")).isEqualTo(base.resolve("office"));
        assertThatThrownBy(() -> InstanceNames.resolve(base, ".."))
                .isInstanceOf(ValidationException.class);
    }
}
