package com.pantiviewer.service;

import com.pantiviewer.util.ProjectLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Registry of the background services of one engine, used for status reporting and
 * orderly shutdown.
 */
public class ServiceManager {
    private final List<BackgroundService> registeredServices = new CopyOnWriteArrayList<>();

    public void registerService(BackgroundService service) {
        if (!registeredServices.contains(service)) {
            registeredServices.add(service);
        }
    }

    public List<BackgroundService> getActiveServices() {
        return registeredServices.stream()
                .filter(BackgroundService::isRunning)
                .collect(Collectors.toList());
    }

    /**
     * Summarizes the running services, e.g. "watcher (2 roots), asset-cache (idle)".
     */
    public String getGlobalStatus() {
        List<String> activeTasks = new ArrayList<>();
        for (BackgroundService service : registeredServices) {
            if (service.isRunning()) {
                activeTasks.add(service.getServiceName() + " (" + service.getStatus() + ")");
            }
        }
        return activeTasks.isEmpty() ? "idle" : String.join(", ", activeTasks);
    }

    /**
     * Checks if a service of the given type is currently running.
     */
    public boolean isServiceRunning(Class<? extends BackgroundService> serviceClass) {
        return registeredServices.stream()
                .anyMatch(s -> serviceClass.isInstance(s) && s.isRunning());
    }

    /**
     * Stops all registered services, most recently registered first, and clears the registry.
     */
    public void shutdown() {
        List<BackgroundService> services = new ArrayList<>(registeredServices);
        for (int i = services.size() - 1; i >= 0; i--) {
            BackgroundService service = services.get(i);
            try {
                service.stopService();
            } catch (RuntimeException e) {
                ProjectLogger.logError(null, "ServiceManager", "Failed to stop " + service.getServiceName(), e);
            }
        }
        registeredServices.clear();
    }
}
