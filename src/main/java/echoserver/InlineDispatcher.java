package echoserver;

import java.util.concurrent.atomic.AtomicInteger;

public class InlineDispatcher implements ConnectionDispatcher {

    private final AtomicInteger inFlight = new AtomicInteger();

    @Override
    public void dispatch(Connection connection, Runnable handler) {
        this.inFlight.incrementAndGet();
        try {
            handler.run();
        } finally {
            this.inFlight.decrementAndGet();
        }
    }

    @Override
    public void awaitTermination() {
        // Nothing outlives dispatch()
    }

    @Override
    public int inFlight() {
        return this.inFlight.get();
    }
}
