package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.api.ProxyType;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Rendered daemon configuration of one instance.
 *
 * @param proxyType daemon kind the text is for
 * @param fileName file name inside the instance directory
 * @param content configuration text
 */
public record GeneratedConfig(
        @Nonnull ProxyType proxyType,
        @Nonnull String fileName,
        @Nonnull String content
) {

    public GeneratedConfig {
        Objects.requireNonNull(proxyType, "proxyType");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(content, "content");
    }

    @Nonnull
    public byte[] toBytes() {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
