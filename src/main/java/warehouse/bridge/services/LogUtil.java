package warehouse.bridge.services;

import io.vertx.core.Vertx;
import warehouse.bridge.Driver;

/**
 * Structured logging helpers on top of the <code>log</code> event bus address.
 * Every entry is a CSV fragment: message, level, component, operation, category.
 * The {@link Logger} verticle appends sequence number and timestamp and writes it out.
 */
public class LogUtil {

    // Log levels matching Driver.logLevel
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    public static final String LOG_ADDRESS = "log";

    private LogUtil() {
    }

    /**
     * Log an error
     */
    public static void logError(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, ERROR, component, operation, category);
    }

    /**
     * Log an error with exception details; the stack trace follows at debug level
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component,
                                String operation, String category) {
        String fullMessage = message + ": " + throwable.getMessage();
        publish(vertx, fullMessage, ERROR, component, operation, category);

        if (Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append("  at ").append(element.toString()).append("\n");
            }
            publish(vertx, "Stack trace: " + stackTrace, DEBUG, component, operation, category);
        }
    }

    /**
     * Log an info message (startup, status, etc)
     */
    public static void logInfo(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= INFO) {
            publish(vertx, message, INFO, component, operation, category);
        }
    }

    /**
     * Log a detailed message
     */
    public static void logDetail(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DETAIL) {
            publish(vertx, message, DETAIL, component, operation, category);
        }
    }

    /**
     * Log a debug message (only in logs)
     */
    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DEBUG) {
            publish(vertx, message, DEBUG, component, operation, category);
        }
    }

    /**
     * Log data/verbose message
     */
    public static void logData(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DATA) {
            publish(vertx, message, DATA, component, operation, category);
        }
    }

    private static void publish(Vertx vertx, String message, int level, String component,
                                String operation, String category) {
        String entry = formatLogMessage(message, level, component, operation, category);
        if (vertx != null) {
            vertx.eventBus().publish(LOG_ADDRESS, entry);
        } else {
            Driver.captureOrPublishLog(entry);
        }
    }

    /**
     * Format log message for event bus
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        // Remove commas and line breaks from the message to keep one CSV row per entry
        String cleanMessage = String.valueOf(message).replace(",", ";").replace("\n", " ").replace("\r", " ");
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }
}
