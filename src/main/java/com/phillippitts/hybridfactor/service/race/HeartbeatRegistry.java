package com.phillippitts.hybridfactor.service.race;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-worker liveness counters for one race.
 *
 * <p>Each entry is written only by its owning worker (the coordinator seeds it at
 * registration); readers take snapshots. Entries are used for liveness inspection only,
 * never to decide whether a result is correct.
 *
 * <p>Entries are independent atomics in a concurrent map, so beating workers never
 * serialize on a shared lock.
 */
public final class HeartbeatRegistry {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public HeartbeatRegistry() {
        this(Clock.systemUTC());
    }

    public HeartbeatRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Seeds an entry with progress 0 and the current instant. Idempotent. */
    public void register(String workerId) {
        entries.computeIfAbsent(workerId, id -> new Entry(clock.instant()));
    }

    /**
     * Records progress for {@code workerId}. Progress lower than the stored value is ignored,
     * so the counter never decreases.
     */
    public void beat(String workerId, long progress) {
        Entry entry = entries.computeIfAbsent(workerId, id -> new Entry(clock.instant()));
        entry.progress.accumulateAndGet(progress, Math::max);
        entry.lastBeat = clock.instant();
    }

    public void markFinished(String workerId) {
        Entry entry = entries.computeIfAbsent(workerId, id -> new Entry(clock.instant()));
        entry.finished = true;
    }

    /** Current progress of {@code workerId}, or -1 if it never registered. */
    public long progress(String workerId) {
        Entry entry = entries.get(workerId);
        return entry == null ? -1 : entry.progress.get();
    }

    /** Snapshot of all entries ordered by worker id. */
    public List<Heartbeat> snapshot() {
        List<Heartbeat> out = new ArrayList<>(entries.size());
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            Entry entry = e.getValue();
            out.add(new Heartbeat(e.getKey(), entry.progress.get(), entry.lastBeat, entry.finished));
        }
        out.sort(Comparator.comparing(Heartbeat::workerId));
        return out;
    }

    /**
     * Workers that are still running but have not beaten for longer than {@code threshold}.
     */
    public List<Heartbeat> stalled(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        List<Heartbeat> out = new ArrayList<>();
        for (Heartbeat hb : snapshot()) {
            if (!hb.finished() && hb.lastBeat().isBefore(cutoff)) {
                out.add(hb);
            }
        }
        return out;
    }

    private static final class Entry {
        private final AtomicLong progress = new AtomicLong();
        private volatile Instant lastBeat;
        private volatile boolean finished;

        private Entry(Instant registeredAt) {
            this.lastBeat = registeredAt;
        }
    }
}
