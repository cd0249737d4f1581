package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;

/**
 * Read-echo-write loop for one connection. Runs until the peer closes, an I/O error occurs
 * or the running flag is lowered. Never throws; every outcome ends with the socket closed.
 */
public class ConnectionHandler implements Runnable {

    public static final int BUFFER_SIZE = 1024;

    private final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Connection connection;
    private final RunningFlag runningFlag;
    private final ConnectionRegistry registry;
    private final int readTimeoutMillis;

    private final byte[] buffer = new byte[BUFFER_SIZE];

    public ConnectionHandler(Connection connection, RunningFlag runningFlag, ConnectionRegistry registry, int readTimeoutMillis) {
        this.connection = connection;
        this.runningFlag = runningFlag;
        this.registry = registry;
        this.readTimeoutMillis = readTimeoutMillis;
    }

    @Override
    public void run() {
        try {
            this.handle();
        } catch (IOException ex) {
            // On read: Connection reset by peer
            // On write: Broken pipe
            logger.warn("Error handling client {}", this.connection, ex);
        } finally {
            this.disconnectClient();
        }
    }

    private void handle() throws IOException {
        this.connection.setReadTimeout(this.readTimeoutMillis);

        InputStream in = this.connection.getInputStream();
        OutputStream out = this.connection.getOutputStream();

        while (this.runningFlag.isRunning()) {
            int byteCount;
            try {
                byteCount = in.read(this.buffer, 0, this.buffer.length); // Blocking
            } catch (SocketTimeoutException ex) {
                // Idle peer; go back and look at the running flag
                continue;
            }

            if (byteCount == -1) {
                logger.info("Client {} disconnected", this.connection);
                return;
            }

            out.write(this.buffer, 0, byteCount);
            out.flush();

            logger.debug("Echoed {} bytes to {}", byteCount, this.connection);
        }

        logger.info("Closing client {} on shutdown", this.connection);
    }

    private void disconnectClient() {
        this.registry.unregister(this.connection);
        try {
            this.connection.close();
        } catch (IOException ex) {
            logger.error("Could not close the client socket {}", this.connection, ex);
        }
    }
}
