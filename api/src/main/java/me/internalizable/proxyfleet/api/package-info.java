/**
 * Public contract of the proxy fleet manager.
 *
 * <p>Provides the typed instance variants, partial updates, certificate
 * parameters and the error taxonomy used by the management layer (HTTP
 * façade, CLI) to drive forward-proxy and TLS-tunnel instances.</p>
 *
 * @see me.internalizable.proxyfleet.api.ProxyFleetAPI
 */
package me.internalizable.proxyfleet.api;
