package com.pantiviewer.service;

/**
 * A long-lived component owning threads, tracked by {@link ServiceManager}.
 */
public interface BackgroundService {
    String getServiceName();

    boolean isRunning();

    /**
     * Short human-readable state, e.g. "3 builds in flight".
     */
    String getStatus();

    /**
     * Stops the service and releases its threads. Must be idempotent.
     */
    void stopService();
}
