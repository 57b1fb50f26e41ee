package com.phillippitts.hybridfactor.service.race;

import com.phillippitts.hybridfactor.domain.FactorPair;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-assignment cell for the factor pair of one race.
 *
 * <p><b>First writer wins:</b> the first {@link #offer(FactorPair)} that acquires the lock
 * while the slot is empty stores its pair; every later offer returns {@code false} and
 * leaves the stored pair untouched.
 *
 * <p><b>Invariant:</b> a stored pair satisfies {@code p * q == N} and {@code 1 < p <= q < N}.
 *
 * <p><b>Thread Safety:</b> the read-check-write of {@link #offer} runs under a dedicated
 * {@link ReentrantLock}; no other lock is ever taken while it is held. Waiters block on
 * {@link #completion()} instead of polling.
 */
public final class ResultSlot {

    private final BigInteger n;
    private final ReentrantLock lock = new ReentrantLock();
    private final CompletableFuture<FactorPair> filled = new CompletableFuture<>();

    // Guarded by lock
    private FactorPair value;

    public ResultSlot(BigInteger n) {
        this.n = Objects.requireNonNull(n, "n");
    }

    /**
     * Stores {@code pair} if the slot is still empty.
     *
     * @return true if this call filled the slot, false if another writer got there first
     * @throws IllegalArgumentException if {@code pair} is not a nontrivial split of N
     */
    public boolean offer(FactorPair pair) {
        Objects.requireNonNull(pair, "pair");
        if (!pair.isSplit() || !pair.product().equals(n)) {
            throw new IllegalArgumentException("not a nontrivial factorization of " + n + ": " + pair);
        }
        lock.lock();
        try {
            if (value != null) {
                return false;
            }
            value = pair;
        } finally {
            lock.unlock();
        }
        filled.complete(pair);
        return true;
    }

    public Optional<FactorPair> get() {
        lock.lock();
        try {
            return Optional.ofNullable(value);
        } finally {
            lock.unlock();
        }
    }

    public boolean isFilled() {
        return get().isPresent();
    }

    /**
     * A future completed with the stored pair once the slot is filled. Completing or
     * cancelling the returned future does not affect the slot.
     */
    public CompletableFuture<FactorPair> completion() {
        return filled.copy();
    }

    public BigInteger n() {
        return n;
    }
}
