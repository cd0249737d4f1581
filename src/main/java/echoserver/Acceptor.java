package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Accept loop. Blocks on the listener while the running flag is up and hands every accepted
 * socket to the dispatcher. Shutdown unblocks it by closing the listener.
 */
public class Acceptor implements Runnable {

    static final long ACCEPT_RETRY_DELAY_MILLIS = 100;

    private final Logger logger = LoggerFactory.getLogger(Acceptor.class);

    private final ServerSocket serverSocket;
    private final RunningFlag runningFlag;
    private final ConnectionRegistry registry;
    private final ConnectionDispatcher dispatcher;
    private final int readTimeoutMillis;
    private final Runnable onListenerFailure;

    private long lastConnectionId;

    public Acceptor(
        ServerSocket serverSocket,
        RunningFlag runningFlag,
        ConnectionRegistry registry,
        ConnectionDispatcher dispatcher,
        int readTimeoutMillis,
        Runnable onListenerFailure
    ) {
        this.serverSocket = serverSocket;
        this.runningFlag = runningFlag;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.readTimeoutMillis = readTimeoutMillis;
        this.onListenerFailure = onListenerFailure;
    }

    @Override
    public void run() {
        while (this.runningFlag.isRunning()) {
            Socket clientSocket;
            try {
                clientSocket = this.serverSocket.accept(); // Blocking
            } catch (IOException ex) {
                if (!this.runningFlag.isRunning()) {
                    // Listener closed by shutdown
                    break;
                }
                if (this.serverSocket.isClosed()) {
                    logger.error("Listener is no longer usable, shutting down", ex);
                    this.onListenerFailure.run();
                    break;
                }
                // Usually a peer that reset during the handshake
                logger.error("Error accepting connection", ex);
                if (!this.pauseBeforeRetry()) {
                    break;
                }
                continue;
            }

            if (!this.runningFlag.isRunning()) {
                this.reject(clientSocket);
                break;
            }

            Connection connection = new Connection(++this.lastConnectionId, clientSocket);
            logger.info("New client connected: {}", connection);

            this.registry.register(connection);
            try {
                this.dispatcher.dispatch(
                    connection,
                    new ConnectionHandler(connection, this.runningFlag, this.registry, this.readTimeoutMillis)
                );
            } catch (RuntimeException | OutOfMemoryError ex) {
                // OutOfMemoryError here is Thread.start running out of native threads
                logger.error("Could not dispatch client {}", connection, ex);
                this.drop(connection);
            }
        }

        logger.info("Acceptor stopped");
    }

    // Keeps a persistent failure (e.g. too many open files) from spinning the loop
    private boolean pauseBeforeRetry() {
        try {
            Thread.sleep(ACCEPT_RETRY_DELAY_MILLIS);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.error("Acceptor interrupted, shutting down");
            this.onListenerFailure.run();
            return false;
        }
    }

    private void drop(Connection connection) {
        this.registry.unregister(connection);
        try {
            connection.close();
        } catch (IOException ex) {
            logger.warn("Could not close undispatched client {}", connection, ex);
        }
    }

    private void reject(Socket clientSocket) {
        logger.info("Rejecting {} during shutdown", clientSocket.getRemoteSocketAddress());
        try {
            clientSocket.close();
        } catch (IOException ex) {
            logger.warn("Could not close rejected socket", ex);
        }
    }
}
