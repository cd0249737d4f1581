package echoserver;

import java.time.Duration;
import java.util.Objects;

public final class ServerConfig {

    private final ListenerConfig listener;
    private final ServerMode mode;
    private final Duration readTimeout;

    private ServerConfig(Builder builder) {
        this.listener = Objects.requireNonNull(builder.listener, "listener");
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.readTimeout = Objects.requireNonNull(builder.readTimeout, "readTimeout");

        if (this.readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must not be negative, got " + this.readTimeout);
        }
        if (this.readTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("readTimeout too large: " + this.readTimeout);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public ListenerConfig getListener() {
        return listener;
    }

    public ServerMode getMode() {
        return mode;
    }

    /**
     * Upper bound on a single blocking read. This is also how long an idle connection
     * may take to notice a shutdown. {@link Duration#ZERO} means reads never time out.
     */
    public Duration getReadTimeout() {
        return readTimeout;
    }

    @Override
    public String toString() {
        return "ServerConfig{listener=" + listener + ", mode=" + mode + ", readTimeout=" + readTimeout + "}";
    }

    public static final class Builder {
        private ListenerConfig listener = ListenerConfig.builder().build();
        private ServerMode mode = ServerMode.MULTI_THREADED;
        private Duration readTimeout = Duration.ofMillis(500);

        private Builder() {
        }

        public Builder listener(ListenerConfig listener) {
            this.listener = listener;
            return this;
        }

        public Builder mode(ServerMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
