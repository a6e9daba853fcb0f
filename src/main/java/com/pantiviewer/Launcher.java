package com.pantiviewer;

import com.pantiviewer.model.ScanReport;
import com.pantiviewer.util.IngestSettings;
import com.pantiviewer.util.ProjectLogger;
import com.pantiviewer.util.SettingsManager;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the ingestion core as a standalone process: {@code Launcher [settings.json]}.
 */
public class Launcher {

    private static final String DEFAULT_SETTINGS = "panti-settings.json";

    public static void main(String[] args) {
        Path settingsFile = Paths.get(args.length > 0 ? args[0] : DEFAULT_SETTINGS);
        IngestSettings settings = new SettingsManager().load(settingsFile);

        IngestEngine engine = new IngestEngine(settings);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            engine.close();
            stopped.countDown();
        }, "shutdown"));

        try {
            engine.startWatching();
        } catch (IOException e) {
            ProjectLogger.logError(null, "Launcher", "Live watching unavailable, only scans will update the catalog", e);
        }

        ScanReport report = engine.scanAll();
        ProjectLogger.logInfo(null, "Launcher", "Initial scan finished: " + report);

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
