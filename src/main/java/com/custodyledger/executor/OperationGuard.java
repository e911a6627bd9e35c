package com.custodyledger.executor;

import com.custodyledger.common.exception.ReentrancyRejectedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Guard that admits one ledger operation at a time and refuses re-entry.
 *
 * An operation holds the guard through a {@link Permit} obtained in a
 * try-with-resources block, so the guard returns to {@link GuardState#IDLE} on
 * every exit path.
 *
 * Rejected with {@link ReentrancyRejectedException}:
 * - a call from the thread that already holds the guard
 * - a call from any thread while the holder is in an outbound interaction
 *   (see {@link Permit#interact}), since that call may be the interaction
 *   calling back through another thread
 * - a call that could not enter within the acquire timeout
 *
 * Other calls wait until the running operation has finished.
 */
@Slf4j
public class OperationGuard {

    public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(2);

    private final ReentrantLock lock = new ReentrantLock(true);

    private final Duration acquireTimeout;

    private volatile GuardState state = GuardState.IDLE;

    private volatile boolean interacting;

    public OperationGuard() {
        this(DEFAULT_ACQUIRE_TIMEOUT);
    }

    public OperationGuard(Duration acquireTimeout) {
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("Acquire timeout must not be negative: " + acquireTimeout);
        }
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Enter the guard.
     *
     * @throws ReentrancyRejectedException if the call re-enters a running operation
     *         or the guard stays busy for longer than the acquire timeout
     */
    public Permit acquire() {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Rejected re-entrant ledger operation on thread {}", Thread.currentThread().getName());
            throw new ReentrancyRejectedException();
        }
        if (interacting) {
            log.warn("Rejected ledger operation on thread {} during an outbound transfer",
                Thread.currentThread().getName());
            throw new ReentrancyRejectedException("Ledger operation rejected during an outbound transfer");
        }
        if (!tryLock()) {
            log.warn("Ledger guard busy for more than {} on thread {}", acquireTimeout,
                Thread.currentThread().getName());
            throw new ReentrancyRejectedException("Ledger busy, operation not admitted within " + acquireTimeout);
        }
        state = GuardState.IN_PROGRESS;
        return new Permit();
    }

    /**
     * Run a read-only action so that it never observes a half-applied
     * operation. Leaves the guard state untouched; allowed from inside an
     * operation. From other threads it waits at most the acquire timeout.
     *
     * @throws ReentrancyRejectedException if the guard stays busy for longer than the acquire timeout
     */
    public <T> T read(Supplier<T> action) {
        if (!tryLock()) {
            log.warn("Ledger read on thread {} timed out after {}", Thread.currentThread().getName(), acquireTimeout);
            throw new ReentrancyRejectedException("Ledger busy, read not served within " + acquireTimeout);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public GuardState getState() {
        return state;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    private boolean tryLock() {
        if (lock.isHeldByCurrentThread()) {
            lock.lock();
            return true;
        }
        try {
            return lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ledger guard acquisition interrupted", e);
            return false;
        }
    }

    /**
     * Scoped hold on the guard.
     */
    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        /**
         * Run an outbound interaction. While it runs, every other attempt to
         * enter the guard is rejected at once instead of waiting.
         */
        public <T> T interact(Supplier<T> interaction) {
            if (released) {
                throw new IllegalStateException("Permit already released");
            }
            interacting = true;
            try {
                return interaction.get();
            } finally {
                interacting = false;
            }
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            interacting = false;
            state = GuardState.IDLE;
            lock.unlock();
        }
    }
}
