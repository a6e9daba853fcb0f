package com.pantiviewer.model;

import java.time.Instant;

/**
 * Debounced "catalog changed" signal delivered to subscribers.
 */
public class CatalogChange {
    private final Visibility tier;
    private final Instant emittedAt;

    public CatalogChange(Visibility tier, Instant emittedAt) {
        this.tier = tier;
        this.emittedAt = emittedAt;
    }

    public Visibility getTier() { return tier; }
    public Instant getEmittedAt() { return emittedAt; }

    @Override
    public String toString() {
        return "CatalogChange{" + tier + " at " + emittedAt + "}";
    }
}
