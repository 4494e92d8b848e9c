package com.modelops.monitoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fixed-capacity ring of recorded feature vectors. Once full, each append overwrites the oldest
 * slot. Writers never lock; {@link #snapshot()} copies whatever is committed at the time of the
 * call, which may already include a few vectors appended while it ran.
 *
 * <p>Each slot holds its vector together with the sequence number it was appended under. A writer
 * that was delayed past a full wrap-around finds a higher sequence in its slot and drops its
 * vector, so an older observation never replaces a newer one.
 */
final class DriftBuffer {

    private final AtomicReferenceArray<Entry> slots;
    private final AtomicLong appended = new AtomicLong();

    DriftBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Drift buffer capacity must be positive, got " + capacity);
        }
        this.slots = new AtomicReferenceArray<>(capacity);
    }

    void append(Map<String, Double> features) {
        store(appended.getAndIncrement(), features);
    }

    /** Returns false when the slot already carries a newer sequence. */
    boolean store(long sequence, Map<String, Double> features) {
        int slot = (int) (sequence % slots.length());
        Entry next = new Entry(sequence, features);
        while (true) {
            Entry current = slots.get(slot);
            if (current != null && current.sequence() > sequence) {
                return false;
            }
            if (slots.compareAndSet(slot, current, next)) {
                return true;
            }
        }
    }

    List<Map<String, Double>> snapshot() {
        int filled = size();
        List<Map<String, Double>> copy = new ArrayList<>(filled);
        for (int i = 0; i < filled; i++) {
            Entry entry = slots.get(i);
            if (entry != null) {
                copy.add(entry.features());
            }
        }
        return copy;
    }

    int size() {
        return (int) Math.min(appended.get(), slots.length());
    }

    int capacity() {
        return slots.length();
    }

    long totalAppended() {
        return appended.get();
    }

    private record Entry(long sequence, Map<String, Double> features) {
    }
}
