package com.pantiviewer.service;

import com.pantiviewer.model.CatalogChange;
import com.pantiviewer.model.Visibility;
import com.pantiviewer.util.ProjectLogger;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coalesces bursts of catalog mutations into debounced change signals, one pending timer
 * per visibility tier.
 * <p>
 * Producers on any thread hand their request to a single dispatch thread, which owns the
 * timers and delivers the signals. A restricted request rides on a pending public timer;
 * a public request supersedes a pending restricted one since restricted listeners receive
 * public signals too.
 */
public class ChangeNotifier implements BackgroundService {

    private final long delayMillis;
    private final ScheduledExecutorService dispatcher;

    // Confined to the dispatch thread
    private final Map<Visibility, ScheduledFuture<?>> pending = new EnumMap<>(Visibility.class);

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong emitted = new AtomicLong();

    public ChangeNotifier(long delayMillis) {
        this.delayMillis = delayMillis;
        this.dispatcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "catalog-notifier");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Requests a change signal for a tier. Returns immediately.
     */
    public void schedule(Visibility tier) {
        try {
            dispatcher.execute(() -> handleRequest(tier));
        } catch (RejectedExecutionException e) {
            ProjectLogger.logDebug(null, "ChangeNotifier", "Dropped " + tier + " change request after shutdown");
        }
    }

    /**
     * Registers a listener for an audience. A {@link Visibility#PUBLIC} audience only hears
     * public signals, a {@link Visibility#RESTRICTED} one hears both tiers.
     *
     * @return a handle that removes the listener when run
     */
    public Runnable subscribe(Visibility audience, CatalogChangeListener listener) {
        Subscription subscription = new Subscription(audience, listener);
        subscriptions.add(subscription);
        return () -> subscriptions.remove(subscription);
    }

    /**
     * @return the number of signals delivered since start
     */
    public long getEmittedCount() {
        return emitted.get();
    }

    private void handleRequest(Visibility tier) {
        if (tier == Visibility.RESTRICTED && isPending(Visibility.PUBLIC)) {
            return;
        }
        if (tier == Visibility.PUBLIC) {
            cancel(Visibility.RESTRICTED);
        }
        cancel(tier);
        pending.put(tier, dispatcher.schedule(() -> fire(tier), delayMillis, TimeUnit.MILLISECONDS));
    }

    private boolean isPending(Visibility tier) {
        ScheduledFuture<?> future = pending.get(tier);
        return future != null && !future.isDone();
    }

    private void cancel(Visibility tier) {
        ScheduledFuture<?> future = pending.remove(tier);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void fire(Visibility tier) {
        pending.remove(tier);
        CatalogChange change = new CatalogChange(tier, Instant.now());
        emitted.incrementAndGet();
        for (Subscription subscription : subscriptions) {
            if (!subscription.audience.receives(tier)) {
                continue;
            }
            try {
                subscription.listener.onCatalogChange(change);
            } catch (RuntimeException e) {
                ProjectLogger.logError(null, "ChangeNotifier", "Listener failed on " + change, e);
            }
        }
    }

    @Override
    public String getServiceName() {
        return "change-notifier";
    }

    @Override
    public boolean isRunning() {
        return !dispatcher.isShutdown();
    }

    @Override
    public String getStatus() {
        return emitted.get() + " signals sent";
    }

    @Override
    public void stopService() {
        dispatcher.shutdownNow();
    }

    private static class Subscription {
        private final Visibility audience;
        private final CatalogChangeListener listener;

        Subscription(Visibility audience, CatalogChangeListener listener) {
            this.audience = audience;
            this.listener = listener;
        }
    }
}
