package io.surfworks.accelforge.host;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Probes a host by opening a TCP connection to a fixed port.
 */
public final class TcpReachabilityProbe implements ReachabilityProbe {

    /** Port of the accelerator web service */
    public static final int DEFAULT_PORT = 80;

    private final int port;

    public TcpReachabilityProbe() {
        this(DEFAULT_PORT);
    }

    public TcpReachabilityProbe(int port) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.port = port;
    }

    public int port() {
        return port;
    }

    @Override
    public boolean isReachable(String address, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address, port), (int) Math.max(1, timeout.toMillis()));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
