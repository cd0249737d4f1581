package echoserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Starts a dedicated worker thread per connection and remembers it so shutdown can join it.
 */
public class ThreadPerConnectionDispatcher implements ConnectionDispatcher {

    static final String THREAD_NAME_PREFIX = "echo-connection-";

    private final Logger logger = LoggerFactory.getLogger(ThreadPerConnectionDispatcher.class);

    private final List<Thread> workers = new ArrayList<>();

    @Override
    public void dispatch(Connection connection, Runnable handler) {
        Thread worker = new Thread(handler, THREAD_NAME_PREFIX + connection.getId());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler((thread, ex) ->
            logger.error("Worker {} died unexpectedly", thread.getName(), ex));

        synchronized (this.workers) {
            this.workers.removeIf(existing -> !existing.isAlive());
            this.workers.add(worker);
        }

        worker.start();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        List<Thread> pending;
        synchronized (this.workers) {
            pending = new ArrayList<>(this.workers);
        }

        // Join outside the lock so a concurrent dispatch never waits on connection I/O
        for (Thread worker : pending) {
            worker.join();
        }

        synchronized (this.workers) {
            this.workers.removeAll(pending);
        }
        logger.debug("Joined {} worker thread(s)", pending.size());
    }

    int trackedWorkers() {
        synchronized (this.workers) {
            return this.workers.size();
        }
    }

    @Override
    public int inFlight() {
        synchronized (this.workers) {
            int alive = 0;
            for (Thread worker : this.workers) {
                if (worker.isAlive()) {
                    alive++;
                }
            }
            return alive;
        }
    }
}
