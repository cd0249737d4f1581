package echoserver;

import java.util.concurrent.atomic.AtomicBoolean;

public final class RunningFlag {

    private final AtomicBoolean running = new AtomicBoolean(true);

    public boolean isRunning() {
        return this.running.get();
    }

    // true only for the call that actually lowered it
    boolean lower() {
        return this.running.compareAndSet(true, false);
    }
}
