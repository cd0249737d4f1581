package echoserver;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;

public final class Connection implements Closeable {

    private final long id;
    private final Socket socket;
    private final SocketAddress remoteAddress;

    public Connection(long id, Socket socket) {
        this.id = id;
        this.socket = socket;
        this.remoteAddress = socket.getRemoteSocketAddress();
    }

    public long getId() {
        return id;
    }

    public SocketAddress getRemoteAddress() {
        return remoteAddress;
    }

    InputStream getInputStream() throws IOException {
        return this.socket.getInputStream();
    }

    OutputStream getOutputStream() throws IOException {
        return this.socket.getOutputStream();
    }

    void setReadTimeout(int millis) throws IOException {
        this.socket.setSoTimeout(millis);
    }

    public boolean isClosed() {
        return this.socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        this.socket.close();
    }

    @Override
    public String toString() {
        return "#" + id + " " + remoteAddress;
    }
}
