package com.tollgate.executionlog.appender;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/** Deque with Redis list semantics: head is the left (newest) end. */
final class InMemoryExternalLogQueue implements ExternalLogQueue {

    private final Deque<String> items = new ArrayDeque<>();
    private volatile boolean unavailable;

    void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    synchronized void pushRaw(String item) {
        items.addFirst(item);
    }

    /** Oldest first. */
    synchronized List<String> snapshot() {
        List<String> out = new ArrayList<>(items);
        Collections.reverse(out);
        return out;
    }

    @Override
    public synchronized OptionalLong pushIfRoom(String item, int capacity) {
        check();
        if (items.size() >= capacity) return OptionalLong.empty();
        items.addFirst(item);
        return OptionalLong.of(items.size());
    }

    @Override
    public synchronized long pushEvictingOldest(String item, int capacity) {
        check();
        items.addFirst(item);
        long evicted = 0;
        while (items.size() > capacity) {
            items.pollLast();
            evicted++;
        }
        return evicted;
    }

    @Override
    public synchronized Optional<String> popOldest() {
        check();
        return Optional.ofNullable(items.pollLast());
    }

    private void check() {
        if (unavailable) {
            throw new IllegalStateException("connection refused");
        }
    }
}
