package com.rpagent.lifecycle;

import com.rpagent.providerconfig.ProviderIdentity;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per identity, so operations on an identity run in arrival order while different
 * identities proceed in parallel. Locks are reference-counted and dropped once nobody holds or
 * waits for them.
 */
final class IdentityLocks {

    private final Map<ProviderIdentity, Entry> locks = new HashMap<>();

    <T> T withLock(ProviderIdentity identity, Supplier<T> action) {
        Entry entry;
        synchronized (locks) {
            entry = locks.computeIfAbsent(identity, k -> new Entry());
            entry.refs++;
        }
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            synchronized (locks) {
                if (--entry.refs == 0) {
                    locks.remove(identity);
                }
            }
        }
    }

    /** Identities with a lock currently held or awaited. */
    int size() {
        synchronized (locks) {
            return locks.size();
        }
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock(true);
        int refs;
    }
}
