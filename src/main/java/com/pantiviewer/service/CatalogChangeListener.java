package com.pantiviewer.service;

import com.pantiviewer.model.CatalogChange;

/**
 * Receives debounced catalog change signals, typically to push a refresh message to
 * connected clients. Called on the notifier's dispatch thread; implementations must not block.
 */
@FunctionalInterface
public interface CatalogChangeListener {
    void onCatalogChange(CatalogChange change);
}
