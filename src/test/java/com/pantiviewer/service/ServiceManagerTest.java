package com.pantiviewer.service;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ServiceManagerTest {

    private static BackgroundService service(String name, boolean running, String status) {
        BackgroundService service = mock(BackgroundService.class);
        lenient().when(service.getServiceName()).thenReturn(name);
        lenient().when(service.isRunning()).thenReturn(running);
        lenient().when(service.getStatus()).thenReturn(status);
        return service;
    }

    @Test
    void testGetGlobalStatus_ShouldListRunningServicesOnly() {
        ServiceManager manager = new ServiceManager();
        manager.registerService(service("watcher", true, "3 directories"));
        manager.registerService(service("asset-cache", false, "idle"));

        assertEquals("watcher (3 directories)", manager.getGlobalStatus());
        assertEquals(1, manager.getActiveServices().size());
    }

    @Test
    void testGetGlobalStatus_NothingRunning_ShouldBeIdle() {
        assertEquals("idle", new ServiceManager().getGlobalStatus());
    }

    @Test
    void testRegisterService_Twice_ShouldKeepOneEntry() {
        ServiceManager manager = new ServiceManager();
        BackgroundService watcher = service("watcher", true, "ok");

        manager.registerService(watcher);
        manager.registerService(watcher);

        assertEquals(1, manager.getActiveServices().size());
    }

    /**
     * Verifies that shutdown stops services in reverse order and survives a failing one.
     */
    @Test
    void testShutdown_ShouldStopInReverseOrder() {
        // 1. Arrange
        ServiceManager manager = new ServiceManager();
        BackgroundService first = service("notifier", true, "ok");
        BackgroundService second = service("asset-cache", true, "ok");
        doThrow(new IllegalStateException("stuck")).when(second).stopService();
        manager.registerService(first);
        manager.registerService(second);

        // 2. Act
        manager.shutdown();

        // 3. Assert
        InOrder inOrder = inOrder(second, first);
        inOrder.verify(second).stopService();
        inOrder.verify(first).stopService();
        assertTrue(manager.getActiveServices().isEmpty());
    }

    @Test
    void testIsServiceRunning_ShouldMatchByType() {
        ServiceManager manager = new ServiceManager();
        ChangeNotifier notifier = new ChangeNotifier(10);
        manager.registerService(notifier);

        assertTrue(manager.isServiceRunning(ChangeNotifier.class));
        assertFalse(manager.isServiceRunning(WatcherService.class));

        manager.shutdown();
        assertFalse(notifier.isRunning());
    }
}
