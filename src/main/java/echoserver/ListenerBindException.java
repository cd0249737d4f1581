package echoserver;

import java.io.IOException;

/**
 * The listening socket could not be created, bound or put into listen state.
 * Fatal to startup; never retried.
 */
public class ListenerBindException extends IOException {

    private final String address;

    public ListenerBindException(String address, Throwable cause) {
        super("Could not listen on " + address + ": " + describe(cause), cause);
        this.address = address;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }

    public String getAddress() {
        return address;
    }
}
