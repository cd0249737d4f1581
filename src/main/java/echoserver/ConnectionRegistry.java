package echoserver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live connections, keyed by id. The lock guards the map only and is never held across socket I/O.
 */
public final class ConnectionRegistry {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, Connection> connections = new LinkedHashMap<>();

    public void register(Connection connection) {
        this.lock.writeLock().lock();
        try {
            this.connections.put(connection.getId(), connection);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public boolean unregister(Connection connection) {
        this.lock.writeLock().lock();
        try {
            return this.connections.remove(connection.getId(), connection);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public int size() {
        this.lock.readLock().lock();
        try {
            return this.connections.size();
        } finally {
            this.lock.readLock().unlock();
        }
    }

    public List<Connection> snapshot() {
        this.lock.readLock().lock();
        try {
            return new ArrayList<>(this.connections.values());
        } finally {
            this.lock.readLock().unlock();
        }
    }

    /**
     * Forgets every entry. Sockets are left to their handlers to close.
     */
    public void clear() {
        this.lock.writeLock().lock();
        try {
            this.connections.clear();
        } finally {
            this.lock.writeLock().unlock();
        }
    }
}
