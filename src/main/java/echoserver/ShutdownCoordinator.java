package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;

/**
 * Owns the only write to the running flag. {@link #stop()} lowers it, closes the listener
 * and waits for the acceptor and every handler to return. Handlers are never killed.
 */
public class ShutdownCoordinator {

    private final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final RunningFlag runningFlag;
    private final ServerSocket serverSocket;
    private final Thread acceptorThread;
    private final ConnectionDispatcher dispatcher;
    private final ConnectionRegistry registry;

    private final Object stopLock = new Object();
    private boolean stopped;

    public ShutdownCoordinator(
        RunningFlag runningFlag,
        ServerSocket serverSocket,
        Thread acceptorThread,
        ConnectionDispatcher dispatcher,
        ConnectionRegistry registry
    ) {
        this.runningFlag = runningFlag;
        this.serverSocket = serverSocket;
        this.acceptorThread = acceptorThread;
        this.dispatcher = dispatcher;
        this.registry = registry;
    }

    /**
     * Lowers the flag and unblocks accept. Does not wait; safe to call from the acceptor itself.
     */
    public void requestStop() {
        if (this.runningFlag.lower()) {
            logger.info("Shutdown signal sent");
        }
        this.closeListener();
    }

    /**
     * Requests shutdown and blocks until the acceptor and all handlers have finished.
     * Later calls return immediately.
     */
    public void stop() {
        synchronized (this.stopLock) {
            if (this.stopped) {
                logger.warn("Server was already stopped");
                return;
            }

            this.requestStop();

            try {
                if (Thread.currentThread() != this.acceptorThread) {
                    this.acceptorThread.join();
                }
                // Acceptor is gone, so no handler can be dispatched after this point
                logger.info("Waiting for {} connection(s) to finish", this.registry.size());
                this.dispatcher.awaitTermination();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for connections to finish", ex);
                return;
            }

            this.registry.clear();
            this.stopped = true;
            logger.info("Server stopped");
        }
    }

    public boolean isStopped() {
        synchronized (this.stopLock) {
            return this.stopped;
        }
    }

    private void closeListener() {
        if (this.serverSocket.isClosed()) {
            return;
        }
        try {
            this.serverSocket.close();
        } catch (IOException ex) {
            logger.error("Could not close the listener", ex);
        }
    }
}
