package com.rpagent.lifecycle;

import com.rpagent.providerconfig.ProviderIdentity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentityLocksTest {

    private static final ProviderIdentity A = ProviderIdentity.of("org.apache.mesos.rp.x", "a");
    private static final ProviderIdentity B = ProviderIdentity.of("org.apache.mesos.rp.x", "b");

    @Test
    void withLock_serializesSameIdentityAndReleasesEntries() throws Exception {
        IdentityLocks locks = new IdentityLocks();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 20; i++) {
                pool.submit(() -> locks.withLock(A, () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleep(2);
                    return inside.decrementAndGet();
                }));
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, locks.size());
    }

    @Test
    void withLock_letsDifferentIdentitiesOverlap() throws Exception {
        IdentityLocks locks = new IdentityLocks();
        CountDownLatch bothInside = new CountDownLatch(2);
        List<Boolean> overlapped = Collections.synchronizedList(new ArrayList<>());
        Thread ta = new Thread(() -> locks.withLock(A, () -> overlapped.add(await(bothInside))));
        Thread tb = new Thread(() -> locks.withLock(B, () -> overlapped.add(await(bothInside))));

        ta.start();
        tb.start();
        ta.join(5000);
        tb.join(5000);

        assertEquals(List.of(true, true), overlapped);
    }

    private static boolean await(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
