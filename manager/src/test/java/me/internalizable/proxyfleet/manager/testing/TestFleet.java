package me.internalizable.proxyfleet.manager.testing;

import me.internalizable.proxyfleet.manager.config.FleetConfig;
import me.internalizable.proxyfleet.manager.registry.PortAllocator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Fleet configuration and helpers for tests that spawn {@link FakeDaemon}.
 */
public final class TestFleet {

    private TestFleet() {
    }

    /**
     * Configuration with both daemon kinds backed by {@link FakeDaemon}.
     */
    public static FleetConfig config(Path dataDirectory) {
        FleetConfig config = new FleetConfig();
        config.setDataDirectory(dataDirectory.toString());
        config.setDaemonUser(null);
        config.setDaemonGroup(null);
        config.setHealthCheckIntervalSeconds(1);
        config.setProcessStartTimeoutSeconds(15);
        config.setProcessStopTimeoutSeconds(5);

        List<String> arguments = List.of("-cp", testClasspath(), FakeDaemon.class.getName(),
                "{config}", "{port}", "{dir}");
        config.getForwardProxy().setBinary(javaBinary());
        config.getForwardProxy().setArguments(new ArrayList<>(arguments));
        config.getTlsTunnel().setBinary(javaBinary());
        config.getTlsTunnel().setArguments(new ArrayList<>(arguments));
        config.getTlsTunnel().setModulePath(null);
        return config;
    }

    /**
     * Find a free port whose cover port is free as well.
     */
    public static int freePort() {
        for (int attempt = 0; attempt < 100; attempt++) {
            int port;
            try (ServerSocket socket = new ServerSocket(0)) {
                port = socket.getLocalPort();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            int cover = PortAllocator.coverPortFor(port);
            if (port >= 1024 && cover <= 65535 && isBindable(cover)) {
                return port;
            }
        }
        throw new IllegalStateException("No free port pair found");
    }

    public static boolean isBindable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static boolean isListening(int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress("127.0.0.1", port), 200);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Make the next start of an instance behave as {@code mode}.
     */
    public static void setMode(Path instanceDirectory, String mode) throws IOException {
        Files.createDirectories(instanceDirectory);
        Files.writeString(instanceDirectory.resolve(FakeDaemon.MODE_FILE), mode, StandardCharsets.UTF_8);
    }

    public static void clearMode(Path instanceDirectory) throws IOException {
        Files.deleteIfExists(instanceDirectory.resolve(FakeDaemon.MODE_FILE));
    }

    private static String javaBinary() {
        return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
    }

    private static String testClasspath() {
        try {
            return Paths.get(FakeDaemon.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
