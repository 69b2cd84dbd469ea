package agents.gateway.services;

import agents.gateway.Driver;
import io.vertx.core.Vertx;

/**
 * Helpers that format and publish CSV log records to the Logger, gated by {@link Driver#logLevel}.
 */
public class LogUtil {

    // Log levels matching the Driver.logLevel
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    /**
     * Log an error that should always appear in the logs
     */
    public static void logError(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, message, ERROR, component, operation, category);
    }

    /**
     * Log an error with exception details; the stack trace follows at debug level
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String operation, String category) {
        publish(vertx, message + ": " + throwable.getMessage(), ERROR, component, operation, category);

        if (Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append(" at ").append(element.toString());
            }
            publish(vertx, "Stack trace:" + stackTrace, DEBUG, component, operation, category);
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

    public static void logDetail(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DETAIL) {
            publish(vertx, message, DETAIL, component, operation, category);
        }
    }

    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DEBUG) {
            publish(vertx, message, DEBUG, component, operation, category);
        }
    }

    private static void publish(Vertx vertx, String message, int level, String component, String operation, String category) {
        if (vertx != null) {
            vertx.eventBus().publish(Logger.LOG_ADDRESS, formatLogMessage(message, level, component, operation, category));
        }
    }

    /**
     * Format log message for event bus
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        // Remove any commas and line breaks from the message to avoid CSV issues
        String cleanMessage = String.valueOf(message).replace(",", ";").replace("\n", " ").replace("\r", " ");
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }
}
