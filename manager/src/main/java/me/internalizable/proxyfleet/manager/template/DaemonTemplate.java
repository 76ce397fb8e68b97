package me.internalizable.proxyfleet.manager.template;

import me.internalizable.proxyfleet.manager.registry.InstanceLayout;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;

import javax.annotation.Nonnull;

/**
 * Renders the configuration file of one daemon kind.
 *
 * <p>Implementations must be deterministic: the same record and layout
 * always render to the same text. They never look at the filesystem.</p>
 */
public interface DaemonTemplate {

    /**
     * Render the configuration of an instance.
     *
     * @param record instance record
     * @param layout instance paths referenced by the configuration
     * @return configuration text
     */
    @Nonnull
    String render(@Nonnull InstanceRecord record, @Nonnull InstanceLayout layout);
}
