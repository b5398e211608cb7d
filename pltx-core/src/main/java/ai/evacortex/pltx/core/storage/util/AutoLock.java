/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.util;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Lock scope for try-with-resources, used by the signal catalog (read/write) and by
 * file handles (exclusive seek+read).
 *
 * <p>
 * The lock is taken when the scope is created. {@link #close()} releases it once;
 * closing the same scope again does nothing, so a scope can never release a hold it
 * does not own.
 * </p>
 */
public final class AutoLock implements AutoCloseable {
    private final Lock lock;
    private boolean held;

    private AutoLock(Lock lock) {
        this.lock = lock;
        this.lock.lock();
        this.held = true;
    }

    /** Scope over a plain mutual-exclusion lock. */
    public static AutoLock exclusive(Lock lock) {
        return new AutoLock(lock);
    }

    public static AutoLock read(ReadWriteLock rw) {
        return new AutoLock(rw.readLock());
    }

    public static AutoLock write(ReadWriteLock rw) {
        return new AutoLock(rw.writeLock());
    }

    @Override
    public void close() {
        if (!held) return;
        held = false;
        lock.unlock();
    }
}
