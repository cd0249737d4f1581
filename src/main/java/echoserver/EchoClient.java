package echoserver;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Raw byte client for the echo server, plus a console mode that echoes stdin lines.
 */
public class EchoClient implements Closeable {

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    public EchoClient(InetSocketAddress address, Duration timeout) throws IOException {
        this.socket = new Socket();
        try {
            this.socket.connect(address, (int) timeout.toMillis());
            this.socket.setSoTimeout((int) timeout.toMillis());
            this.in = this.socket.getInputStream();
            this.out = this.socket.getOutputStream();
        } catch (IOException ex) {
            this.socket.close();
            throw ex;
        }
    }

    public void send(byte[] payload) throws IOException {
        this.out.write(payload);
        this.out.flush();
    }

    /**
     * Reads exactly {@code length} bytes, however many echo chunks they arrive in.
     */
    public byte[] receive(int length) throws IOException {
        ByteArrayOutputStream received = new ByteArrayOutputStream(length);
        byte[] chunk = new byte[Math.min(Math.max(length, 1), ConnectionHandler.BUFFER_SIZE)];

        while (received.size() < length) {
            int byteCount = this.in.read(chunk, 0, Math.min(chunk.length, length - received.size())); // Blocking
            if (byteCount == -1) {
                throw new EOFException("Server closed after " + received.size() + " of " + length + " bytes");
            }
            received.write(chunk, 0, byteCount);
        }

        return received.toByteArray();
    }

    public byte[] echo(byte[] payload) throws IOException {
        this.send(payload);
        return this.receive(payload.length);
    }

    /**
     * @return {@code true} once the server has closed its side
     */
    public boolean awaitServerClose() throws IOException {
        return this.in.read() == -1;
    }

    /**
     * Half-closes the connection; the server sees end of stream.
     */
    public void shutdownOutput() throws IOException {
        this.socket.shutdownOutput();
    }

    @Override
    public void close() throws IOException {
        this.socket.close();
    }

    public static void main(String[] args) throws IOException {
        String host = args.length > 0 ? args[0] : "localhost";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 4444;

        try (
            EchoClient client = new EchoClient(new InetSocketAddress(host, port), Duration.ofSeconds(30));
            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
        ) {
            String userInput;
            while ((userInput = stdin.readLine()) != null) {
                byte[] reply = client.echo((userInput + "\n").getBytes(StandardCharsets.UTF_8));

                System.out.printf("Echo: %s", new String(reply, StandardCharsets.UTF_8));
            }
        }
    }
}
