package echoserver;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Listening socket settings. Immutable once built.
 */
public final class ListenerConfig {

    private final String address;
    private final boolean reuseAddress;
    private final boolean reusePort;
    private final int backlog;

    private ListenerConfig(Builder builder) {
        this.address = Objects.requireNonNull(builder.address, "address");
        this.reuseAddress = builder.reuseAddress;
        this.reusePort = builder.reusePort;
        this.backlog = builder.backlog;

        if (this.backlog <= 0) {
            throw new IllegalArgumentException("backlog must be positive, got " + this.backlog);
        }
        // Fail on a malformed address here instead of at bind time
        this.socketAddress();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAddress() {
        return address;
    }

    public boolean isReuseAddress() {
        return reuseAddress;
    }

    public boolean isReusePort() {
        return reusePort;
    }

    public int getBacklog() {
        return backlog;
    }

    /**
     * Splits {@code host:port} (or {@code [v6-host]:port}) into a socket address.
     * The host name is resolved on every call.
     */
    public InetSocketAddress socketAddress() {
        int separator = this.address.lastIndexOf(':');
        if (separator <= 0 || separator == this.address.length() - 1) {
            throw new IllegalArgumentException("Address must be host:port, got '" + this.address + "'");
        }

        String host = this.address.substring(0, separator);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        int port;
        try {
            port = Integer.parseInt(this.address.substring(separator + 1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Port is not a number in '" + this.address + "'", ex);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in '" + this.address + "'");
        }

        return new InetSocketAddress(host, port);
    }

    public Builder toBuilder() {
        return new Builder()
            .address(this.address)
            .reuseAddress(this.reuseAddress)
            .reusePort(this.reusePort)
            .backlog(this.backlog);
    }

    @Override
    public String toString() {
        return "ListenerConfig{address=" + address
            + ", reuseAddress=" + reuseAddress
            + ", reusePort=" + reusePort
            + ", backlog=" + backlog + "}";
    }

    public static final class Builder {
        private String address = "127.0.0.1:4444";
        private boolean reuseAddress = true;
        private boolean reusePort = true;
        private int backlog = 42;

        private Builder() {
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder reuseAddress(boolean reuseAddress) {
            this.reuseAddress = reuseAddress;
            return this;
        }

        public Builder reusePort(boolean reusePort) {
            this.reusePort = reusePort;
            return this;
        }

        public Builder backlog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public ListenerConfig build() {
            return new ListenerConfig(this);
        }
    }
}
