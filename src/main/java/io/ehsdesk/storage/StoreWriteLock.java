package io.ehsdesk.storage;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single process-wide guard over every store mutation. Reads never take it.
 *
 * <p>Reentrant, so a caller that already holds it (the report commit step) can call into store
 * methods that take it again.
 */
public final class StoreWriteLock {
    private final ReentrantLock lock = new ReentrantLock();

    public <T> T guard(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void guard(Runnable work) {
        lock.lock();
        try {
            work.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
