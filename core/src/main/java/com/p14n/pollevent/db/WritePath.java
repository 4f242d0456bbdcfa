package com.p14n.pollevent.db;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The single exclusive path through which the store is mutated. Flushes,
 * retention sweeps, backups, restores and imports each hold it for their
 * whole duration; reads never take it.
 */
public class WritePath {

    private final ReentrantLock lock = new ReentrantLock();

    public void lock() {
        lock.lock();
    }

    public boolean tryLock() {
        return lock.tryLock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
