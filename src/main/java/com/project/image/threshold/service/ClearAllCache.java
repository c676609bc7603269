package com.project.image.threshold.service;

import java.util.HashMap;
import java.util.Map;

/**
 * Bounded map that empties itself completely when a new key would exceed its capacity.
 * Replacing the value of a key already present never triggers eviction.
 */
public class ClearAllCache<K, V> {
    private final int capacity;
    private final Map<K, V> entries = new HashMap<>();
    private long evictions;

    public ClearAllCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized V get(K key) {
        return entries.get(key);
    }

    public synchronized void put(K key, V value) {
        if (!entries.containsKey(key) && entries.size() >= capacity) {
            entries.clear();
            evictions++;
        }
        entries.put(key, value);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Number of times the whole cache was dropped to make room. */
    public synchronized long evictions() {
        return evictions;
    }
}
