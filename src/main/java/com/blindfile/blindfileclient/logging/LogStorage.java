/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.logging
Created by: Ashish Kushwaha on 12-10-2026 19:38
File: LogStorage.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.logging;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded in-memory ring of recent entries. Oldest entries are evicted first.
 */
public final class LogStorage {

    private static final int DEFAULT_CAPACITY = 5000;

    private final ArrayDeque<LogEntry> ring;
    private final int capacity;
    private long evicted;

    public LogStorage() {
        this(DEFAULT_CAPACITY);
    }

    public LogStorage(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ring = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void add(LogEntry entry) {
        if (ring.size() == capacity) {
            ring.pollFirst();
            evicted++;
        }
        ring.addLast(entry);
    }

    public synchronized List<LogEntry> getAll() {
        return List.copyOf(ring);
    }

    public synchronized List<LogEntry> filter(Predicate<LogEntry> predicate) {
        List<LogEntry> matches = new ArrayList<>();
        for (LogEntry entry : ring) {
            if (predicate.test(entry)) {
                matches.add(entry);
            }
        }
        return matches;
    }

    public List<LogEntry> filterByLevel(LogLevel minLevel) {
        return filter(e -> e.getLevel().isEnabled(minLevel));
    }

    public List<LogEntry> filterBySource(String source) {
        return filter(e -> e.getSource().equalsIgnoreCase(source));
    }

    public List<LogEntry> since(Instant instant) {
        return filter(e -> !e.getTimestamp().isBefore(instant));
    }

    /**
     * @return up to {@code count} most recent entries, oldest first
     */
    public synchronized List<LogEntry> tail(int count) {
        List<LogEntry> recent = new ArrayList<>(Math.min(count, ring.size()));
        Iterator<LogEntry> it = ring.descendingIterator();
        while (it.hasNext() && recent.size() < count) {
            recent.add(0, it.next());
        }
        return recent;
    }

    public synchronized void clear() {
        ring.clear();
    }

    public synchronized int size() {
        return ring.size();
    }

    public synchronized long getEvictedCount() {
        return evicted;
    }

    public int getCapacity() {
        return capacity;
    }
}
