package com.pantiviewer.service;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * In-memory working set of checksums already in the catalog. It only saves store round
 * trips: a miss here is always confirmed against the store.
 */
public class KnownChecksums {

    private final Object lock = new Object();
    private final Set<String> checksums = new HashSet<>();

    public boolean contains(String checksum) {
        synchronized (lock) {
            return checksums.contains(checksum);
        }
    }

    public void add(String checksum) {
        synchronized (lock) {
            checksums.add(checksum);
        }
    }

    public void remove(String checksum) {
        synchronized (lock) {
            checksums.remove(checksum);
        }
    }

    /**
     * Replaces the whole set, typically with a fresh snapshot of the store.
     */
    public void replaceAll(Collection<String> snapshot) {
        synchronized (lock) {
            checksums.clear();
            checksums.addAll(snapshot);
        }
    }

    public int size() {
        synchronized (lock) {
            return checksums.size();
        }
    }
}
