package in.co.kitree.jyotish.services;

import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured logging facade over Log4j2.
 *
 * <p>Messages are snake_case event names. Request-scoped context (request id, function,
 * subject of the computation) lives in the {@link ThreadContext}; per-event data is attached as a
 * JSON string under {@value #KEY_DATA} for the duration of one log call.</p>
 *
 * <pre>
 * long start = LoggingService.logOperationStart("panchanga", Map.of("date", "2024-04-09"));
 * ...
 * LoggingService.logOperationEnd("panchanga", start);
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_SUBJECT = "subject";
    public static final String KEY_DATA = "data";

    /**
     * Start a fresh logging context. A random id is generated when none is given.
     */
    public static void initRequest(String requestId) {
        clearContext();
        ThreadContext.put(KEY_REQUEST_ID, requestId != null ? requestId : UUID.randomUUID().toString());
    }

    /**
     * Set the current function being executed.
     *
     * @param function Function name (e.g., "get_panchanga")
     */
    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    /**
     * What the request is about, e.g. "28.6139,77.2090@2024-04-09".
     */
    public static void setSubject(String subject) {
        if (subject != null) {
            ThreadContext.put(KEY_SUBJECT, subject);
        }
    }

    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Operation timing
    // =========================================================================

    /**
     * Log the start of an operation. Returns start time for use with logOperationEnd.
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        info(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        info(operation + "_completed", Map.of("durationMs", duration));
    }

    /**
     * Engine rejections are expected outcomes and go out at WARN; anything else is an ERROR with stack trace.
     */
    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        long duration = System.currentTimeMillis() - startTime;
        if (t instanceof JyotishException) {
            JyotishException je = (JyotishException) t;
            warn(operation + "_failed", data("durationMs", duration,
                    "errorCode", je.getErrorCode(), "errorMessage", je.getMessage()));
        } else {
            error(operation + "_failed", t, Map.of("durationMs", duration));
        }
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }

    /**
     * Create a mutable map with the given key-value pairs. Null values are allowed, unlike Map.of.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
