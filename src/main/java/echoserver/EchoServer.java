package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Handle to a running echo server.
 *
 * <pre>
 * try (EchoServer server = EchoServer.start(config)) {
 *     ...
 * } // stop() joins every connection thread
 * </pre>
 */
public final class EchoServer implements AutoCloseable {

    static final String ACCEPTOR_THREAD_NAME = "echo-acceptor";

    private final Logger logger = LoggerFactory.getLogger(EchoServer.class);

    private final ServerConfig config;
    private final ServerSocket serverSocket;
    private final RunningFlag runningFlag = new RunningFlag();
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final ConnectionDispatcher dispatcher;
    private final Thread acceptorThread;
    private final ShutdownCoordinator coordinator;

    private EchoServer(ServerConfig config, ServerSocket serverSocket) {
        this.config = config;
        this.serverSocket = serverSocket;
        this.dispatcher = ConnectionDispatcher.forMode(config.getMode());

        Acceptor acceptor = new Acceptor(
            serverSocket,
            this.runningFlag,
            this.registry,
            this.dispatcher,
            (int) config.getReadTimeout().toMillis(),
            this::onListenerFailure
        );
        this.acceptorThread = new Thread(acceptor, ACCEPTOR_THREAD_NAME);
        this.acceptorThread.setDaemon(true);

        this.coordinator = new ShutdownCoordinator(
            this.runningFlag, serverSocket, this.acceptorThread, this.dispatcher, this.registry
        );
    }

    /**
     * Binds the listener and starts accepting in the background.
     *
     * @throws ListenerBindException if the listener cannot be set up; nothing is left running
     */
    public static EchoServer start(ServerConfig config) throws ListenerBindException {
        ServerSocket serverSocket = SocketBuilder.listen(config.getListener());

        EchoServer server = new EchoServer(config, serverSocket);
        server.logger.info("Server is running on {} ({})", server.getLocalAddress(), config.getMode());
        server.acceptorThread.start();

        return server;
    }

    /**
     * Stops accepting, then waits for in-flight connections to notice and finish.
     * Idempotent.
     */
    public void stop() {
        this.coordinator.stop();
    }

    @Override
    public void close() {
        this.stop();
    }

    /**
     * Blocks until the server has been stopped by some other thread and all handlers are done.
     */
    public void awaitTermination() throws InterruptedException {
        this.acceptorThread.join();
        this.dispatcher.awaitTermination();
    }

    public ServerConfig getConfig() {
        return config;
    }

    /**
     * Actual bound address; useful when the configured port is 0.
     */
    public InetSocketAddress getLocalAddress() {
        return (InetSocketAddress) this.serverSocket.getLocalSocketAddress();
    }

    public int getPort() {
        return this.serverSocket.getLocalPort();
    }

    public boolean isRunning() {
        return this.runningFlag.isRunning();
    }

    public boolean isListening() {
        return !this.serverSocket.isClosed();
    }

    public int activeConnections() {
        return this.registry.size();
    }

    public int inFlightHandlers() {
        return this.dispatcher.inFlight();
    }

    ServerSocket getServerSocket() {
        return this.serverSocket;
    }

    private void onListenerFailure() {
        this.coordinator.requestStop();
    }
}
