package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.api.ProxyType;
import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;

import javax.annotation.Nonnull;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an instance record into the configuration text of its daemon.
 *
 * <p>Generation is a pure function of the record, the instance layout and
 * the fleet configuration fixed at construction. Calling it twice with the
 * same record yields byte-identical text. Certificate paths appear only when
 * the record says the daemon serves TLS, whatever exists on disk.</p>
 */
public class ConfigGenerator {

    private final Map<ProxyType, DaemonTemplate> templates = new EnumMap<>(ProxyType.class);

    /**
     * Create a generator from the fleet configuration.
     *
     * @param config fleet configuration
     */
    public ConfigGenerator(@Nonnull FleetConfig config) {
        Objects.requireNonNull(config, "config");
        templates.put(ProxyType.FORWARD_PROXY, new ForwardProxyTemplate(
                config.getForwardProxy(), config.getDaemonUser(), config.isRequireAuthentication()));
        templates.put(ProxyType.TLS_TUNNEL, new TlsTunnelTemplate(
                config.getTlsTunnel(), config.getDaemonUser()));
    }

    /**
     * Render the configuration of an instance.
     *
     * @param record instance record
     * @param layout instance layout
     * @return the rendered configuration
     */
    @Nonnull
    public GeneratedConfig generate(@Nonnull InstanceRecord record, @Nonnull InstanceLayout layout) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(layout, "layout");

        DaemonTemplate template = templates.get(record.proxyType());
        String content = template.render(record, layout);
        String fileName = layout.getConfigFile(record.proxyType()).getFileName().toString();
        return new GeneratedConfig(record.proxyType(), fileName, content);
    }
}
