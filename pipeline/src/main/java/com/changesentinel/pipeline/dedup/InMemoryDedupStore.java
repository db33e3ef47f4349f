package com.changesentinel.pipeline.dedup;

import com.changesentinel.core.model.DedupEntry;
import com.changesentinel.pipeline.api.DedupStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class InMemoryDedupStore implements DedupStore {
    private final Map<String, Instant> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public InMemoryDedupStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean seen(String id) {
        lock.readLock().lock();
        try {
            return entries.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void mark(String id) {
        lock.writeLock().lock();
        try {
            entries.putIfAbsent(id, clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> seenBatch(List<String> ids) {
        lock.readLock().lock();
        try {
            return unseen(ids);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> claim(List<String> ids) {
        lock.writeLock().lock();
        try {
            List<String> fresh = unseen(ids);
            Instant now = clock.instant();
            for (String id : fresh) {
                entries.put(id, now);
            }
            return fresh;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void reset() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<DedupEntry> entries() {
        lock.readLock().lock();
        try {
            List<DedupEntry> copy = new ArrayList<>(entries.size());
            entries.forEach((id, firstSeen) -> copy.add(new DedupEntry(id, firstSeen)));
            return List.copyOf(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void replaceAll(Collection<DedupEntry> loaded) {
        lock.writeLock().lock();
        try {
            entries.clear();
            for (DedupEntry entry : loaded) {
                entries.putIfAbsent(entry.id(), entry.firstSeen());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<String> unseen(List<String> ids) {
        Set<String> fresh = new LinkedHashSet<>();
        for (String id : ids) {
            if (!entries.containsKey(id)) {
                fresh.add(id);
            }
        }
        return new ArrayList<>(fresh);
    }
}
