/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.controller;

import io.capv.operator.common.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class ReconciliationLockManagerTest {
    private static final String VM_1 = "VSphereVM::capv::vm-1";
    private static final String VM_2 = "VSphereVM::capv::vm-2";

    private ReconciliationLockManager locks;

    @BeforeEach
    public void setUp() {
        locks = new ReconciliationLockManager();
    }

    private CompletableFuture<Boolean> tryLockAsync(String key, long timeoutMs) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return locks.tryLock(key, timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });
    }

    @Test
    public void testEntryExistsOnlyWhileHeld() throws InterruptedException {
        assertThat(locks.tryLock(VM_1, 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(locks.isLocked(VM_1), is(true));
        assertThat(locks.isLocked(VM_2), is(false));

        locks.unlock(VM_1);
        assertThat(locks.isLocked(VM_1), is(false));
        assertThat(locks.locks.isEmpty(), is(true));

        assertThat(locks.tryLock(VM_1, 10, TimeUnit.MILLISECONDS), is(true));
        locks.unlock(VM_1);
        assertThat(locks.locks.isEmpty(), is(true));
    }

    @Test
    public void testDifferentVmsDoNotBlockEachOther() throws InterruptedException {
        assertThat(locks.tryLock(VM_1, 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(locks.tryLock(VM_2, 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(locks.locks.size(), is(2));

        locks.unlock(VM_2);
        locks.unlock(VM_1);
        assertThat(locks.locks.isEmpty(), is(true));
    }

    @Test
    public void testSecondLoopTimesOut() throws InterruptedException {
        assertThat(locks.tryLock(VM_1, 10, TimeUnit.MILLISECONDS), is(true));

        assertThat(tryLockAsync(VM_1, 50).join(), is(false));
        // The loop which gave up is no longer counted
        assertThat(locks.locks.get(VM_1).interested, is(1));

        locks.unlock(VM_1);
        assertThat(locks.locks.isEmpty(), is(true));
    }

    @Test
    public void testSecondLoopGetsLockOnRelease() throws InterruptedException {
        assertThat(locks.tryLock(VM_1, 10, TimeUnit.MILLISECONDS), is(true));

        CompletableFuture<Boolean> waiting = tryLockAsync(VM_1, 5_000);
        TestUtils.waitFor("second loop waiting for the lock", 10, 5_000, () -> locks.locks.get(VM_1).interested == 2);

        locks.unlock(VM_1);
        assertThat(waiting.join(), is(true));
        assertThat(locks.isLocked(VM_1), is(true));

        locks.unlock(VM_1);
        assertThat(locks.locks.isEmpty(), is(true));
    }
}
