package echoserver;

public interface ConnectionDispatcher {

    void dispatch(Connection connection, Runnable handler);

    void awaitTermination() throws InterruptedException; // Blocking

    int inFlight();

    static ConnectionDispatcher forMode(ServerMode mode) {
        switch (mode) {
            case SINGLE_THREADED:
                return new InlineDispatcher();
            case MULTI_THREADED:
                return new ThreadPerConnectionDispatcher();
            default:
                throw new IllegalArgumentException("Unsupported mode: " + mode);
        }
    }
}
