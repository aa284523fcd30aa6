package com.loom.orchestrator.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared key/value space for one pipeline run.
 *
 * <p>Every write appends a {@link ContextEntry} to the history log and
 * replaces the key's current value. Nothing is ever removed from the log,
 * so {@link #historyOf(String)} shows how a value evolved across the run.
 *
 * <p>Each key is owned by the first stage that writes it. A later write to
 * the same key from a different stage is rejected with
 * {@link ContextOwnershipException}; the owner itself may overwrite.
 *
 * <p>Absence is a normal state: {@link #get(String)} returns
 * {@link Optional#empty()} for keys nobody has written yet.
 *
 * <p>Writes are serialized by a read/write lock. Readers that need several
 * values at once should take a {@link #snapshot()}.
 */
public class ContextStore {

    /** Pseudo-stage that owns values supplied by the caller of a run. */
    public static final String INPUT_STAGE = "input";

    /** Key holding the run's input text. */
    public static final String INPUT_KEY = "input";

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, String>  current = new LinkedHashMap<>();
    private final Map<String, String>  owners  = new HashMap<>();
    private final List<ContextEntry>   history = new ArrayList<>();
    private long lastSequence = 0;

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<String> get(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(current.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Keys that currently hold a value, in first-write order. */
    public Set<String> allKeys() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(current.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Every value ever written to {@code key}, oldest first. Empty when never written. */
    public List<String> historyOf(String key) {
        lock.readLock().lock();
        try {
            return history.stream()
                    .filter(e -> e.key().equals(key))
                    .map(ContextEntry::value)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Full write log of the run, in sequence order. */
    public List<ContextEntry> history() {
        lock.readLock().lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of the current value per key, in first-write order. */
    public Map<String, String> currentValues() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(current));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> ownerOf(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(owners.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public ContextSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new ContextSnapshot(new LinkedHashMap<>(current), lastSequence);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /** Write a caller-supplied value (attributed to {@link #INPUT_STAGE}). */
    public void set(String key, String value) {
        write(INPUT_STAGE, key, value);
    }

    /**
     * Add another value for {@code key} on behalf of the caller. Same effect as
     * {@link #set}: the history keeps every earlier value.
     */
    public void append(String key, String value) {
        write(INPUT_STAGE, key, value);
    }

    /**
     * Record a write by {@code stageName}.
     *
     * @return the history entry that was appended
     * @throws ContextOwnershipException if another stage owns {@code key}
     */
    public ContextEntry write(String stageName, String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Context key must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("Context value for '" + key + "' must not be null");
        }
        lock.writeLock().lock();
        try {
            String owner = owners.putIfAbsent(key, stageName);
            if (owner != null && !owner.equals(stageName)) {
                throw new ContextOwnershipException(key, owner, stageName);
            }
            ContextEntry entry = new ContextEntry(key, value, stageName, ++lastSequence);
            history.add(entry);
            current.put(key, value);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Write several keys for one stage atomically: readers either see all of
     * them or none. Ownership of every key is checked before anything is written.
     */
    public List<ContextEntry> writeAll(String stageName, Map<String, String> values) {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, String> e : values.entrySet()) {
                String key = e.getKey();
                if (key == null || key.isBlank() || e.getValue() == null) {
                    throw new IllegalArgumentException(
                            "Stage '" + stageName + "' produced a blank key or null value for '" + key + "'");
                }
                String owner = owners.get(key);
                if (owner != null && !owner.equals(stageName)) {
                    throw new ContextOwnershipException(key, owner, stageName);
                }
            }
            List<ContextEntry> written = new ArrayList<>(values.size());
            values.forEach((k, v) -> written.add(write(stageName, k, v)));
            return written;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
