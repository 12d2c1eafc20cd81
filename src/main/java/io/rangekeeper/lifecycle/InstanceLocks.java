package io.rangekeeper.lifecycle;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

final class InstanceLocks {
    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final long waitMs;

    InstanceLocks(long waitMs) {
        this.waitMs = Math.max(1L, waitMs);
    }

    Held tryAcquire(String instanceId) throws InterruptedException {
        Entry entry = locks.compute(instanceId, (id, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.refs++;
            return e;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(waitMs, TimeUnit.MILLISECONDS);
        } finally {
            if (!acquired) {
                release(instanceId);
            }
        }
        return acquired ? new Held(instanceId, entry) : null;
    }

    int size() {
        return locks.size();
    }

    private void release(String instanceId) {
        locks.computeIfPresent(instanceId, (id, e) -> --e.refs == 0 ? null : e);
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int refs;
    }

    final class Held implements AutoCloseable {
        private final String instanceId;
        private final Entry entry;

        private Held(String instanceId, Entry entry) {
            this.instanceId = instanceId;
            this.entry = entry;
        }

        @Override
        public void close() {
            entry.lock.unlock();
            release(instanceId);
        }
    }
}
