package com.pantiviewer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe logging facade used by every ingestion component.
 * Messages are routed to SLF4J loggers named after their context, with the
 * affected watched root exposed to the layout through the {@code root} MDC key.
 * Includes smart aggregation of recurring errors so a folder of ten thousand
 * unreadable files produces one error and one summary line.
 */
public class ProjectLogger {

    private static final String LOGGER_PREFIX = "com.pantiviewer.";
    private static final String MDC_ROOT = "root";
    private static final String GLOBAL_KEY = "<global>";

    // Storage for aggregated errors: root -> (signature -> count)
    private static final Map<String, Map<String, AtomicInteger>> AGGREGATED_ERRORS = new ConcurrentHashMap<>();

    private ProjectLogger() {
    }

    /**
     * Logs an error.
     *
     * @param root    The watched root concerned (can be null)
     * @param context The component name (e.g., "IngestService")
     * @param message The error message
     * @param error   The exception (can be null)
     */
    public static void logError(Path root, String context, String message, Throwable error) {
        Logger log = logger(context);
        withRoot(root, () -> {
            if (error != null) {
                log.error(message, error);
            } else {
                log.error(message);
            }
        });
    }

    /**
     * Logs a recoverable problem that degrades one operation without failing it.
     */
    public static void logWarn(Path root, String context, String message) {
        Logger log = logger(context);
        withRoot(root, () -> log.warn(message));
    }

    public static void logInfo(Path root, String context, String message) {
        Logger log = logger(context);
        withRoot(root, () -> log.info(message));
    }

    public static void logDebug(Path root, String context, String message) {
        Logger log = logger(context);
        if (log.isDebugEnabled()) {
            withRoot(root, () -> log.debug(message));
        }
    }

    /**
     * Logs a recurring error. The first occurrence is logged immediately.
     * Subsequent identical errors (same context, message, and exception type) are aggregated
     * and reported later by {@link #flush(Path)}.
     *
     * @param root    The watched root
     * @param context The context
     * @param message The message
     * @param error   The exception
     */
    public static void logRecurringError(Path root, String context, String message, Throwable error) {
        String signature = generateErrorSignature(context, message, error);

        Map<String, AtomicInteger> rootErrors = AGGREGATED_ERRORS.computeIfAbsent(key(root), k -> new ConcurrentHashMap<>());
        AtomicInteger counter = rootErrors.computeIfAbsent(signature, s -> new AtomicInteger(0));

        if (counter.getAndIncrement() == 0) {
            logError(root, context, message, error);
        }
    }

    /**
     * Writes a summary of how many times each recurring error occurred since the last flush.
     *
     * @param root The watched root
     * @return the number of additional occurrences that were summarized
     */
    public static int flush(Path root) {
        Map<String, AtomicInteger> rootErrors = AGGREGATED_ERRORS.remove(key(root));
        if (rootErrors == null || rootErrors.isEmpty()) {
            return 0;
        }

        int summarized = 0;
        for (Map.Entry<String, AtomicInteger> entry : rootErrors.entrySet()) {
            int total = entry.getValue().get();
            if (total > 1) {
                // The first one was already logged
                int additional = total - 1;
                summarized += additional;
                logWarn(root, "ErrorAggregation",
                        String.format("The following error occurred %d additional times: %s", additional, entry.getKey()));
            }
        }
        return summarized;
    }

    private static String generateErrorSignature(String context, String message, Throwable error) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(context).append("] ").append(message);
        if (error != null) {
            sb.append(" | ").append(error.getClass().getName());
            if (error.getMessage() != null) {
                sb.append(": ").append(error.getMessage());
            }
        }
        return sb.toString();
    }

    private static Logger logger(String context) {
        return LoggerFactory.getLogger(LOGGER_PREFIX + (context == null ? "core" : context));
    }

    private static String key(Path root) {
        return root == null ? GLOBAL_KEY : root.toString();
    }

    private static void withRoot(Path root, Runnable action) {
        if (root == null) {
            action.run();
            return;
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_ROOT, root.toString())) {
            action.run();
        }
    }
}
