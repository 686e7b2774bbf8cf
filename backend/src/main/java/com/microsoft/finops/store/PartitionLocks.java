package com.microsoft.finops.store;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process advisory locks keyed by string (batch ids, "cloud/account" partitions).
 *
 * Keys are always acquired in sorted order, so two writers with overlapping key
 * sets cannot deadlock.
 */
@Component
public class PartitionLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        List<ReentrantLock> acquired = new ArrayList<>();
        try {
            for (String key : new TreeSet<>(keys)) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }
}
