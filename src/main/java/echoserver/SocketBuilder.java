package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.StandardSocketOptions;

public final class SocketBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SocketBuilder.class);

    private SocketBuilder() {
    }

    /**
     * Opens a listening socket. Reuse options are applied before bind and the backlog at listen time.
     *
     * @throws ListenerBindException on any failure; the half-built socket is closed first
     */
    public static ServerSocket listen(ListenerConfig config) throws ListenerBindException {
        ServerSocket serverSocket = null;
        try {
            InetSocketAddress address = config.socketAddress();
            if (address.isUnresolved()) {
                throw new IOException("Unresolved host " + address.getHostString());
            }

            serverSocket = new ServerSocket(); // Unbound
            serverSocket.setReuseAddress(config.isReuseAddress());

            if (config.isReusePort()) {
                if (serverSocket.supportedOptions().contains(StandardSocketOptions.SO_REUSEPORT)) {
                    serverSocket.setOption(StandardSocketOptions.SO_REUSEPORT, true);
                } else {
                    logger.warn("SO_REUSEPORT is not supported on this platform, binding {} without it", config.getAddress());
                }
            }

            serverSocket.bind(address, config.getBacklog());
            logger.debug("Bound {} with backlog {}", serverSocket.getLocalSocketAddress(), config.getBacklog());

            return serverSocket;
        } catch (IOException | IllegalArgumentException ex) {
            closeQuietly(serverSocket, config);
            throw new ListenerBindException(config.getAddress(), ex);
        }
    }

    private static void closeQuietly(ServerSocket serverSocket, ListenerConfig config) {
        if (serverSocket == null) {
            return;
        }
        try {
            serverSocket.close();
        } catch (IOException ex) {
            logger.warn("Could not close the listener for {} after a failed bind", config.getAddress(), ex);
        }
    }
}
