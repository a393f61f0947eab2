package qctl.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.graph.StateGraphBuilder;

import java.util.Map;

/**
 * Settings of a checker run. Defaults can be overridden from the environment:
 * <ul>
 *   <li>{@code QCTL_MAX_STATES}: exploration bound (default 1000000)</li>
 *   <li>{@code QCTL_THREADS}: worker threads for formula batches (default 1)</li>
 *   <li>{@code QCTL_INCLUDE_DEGREE_MAP}: put every state's degree in reports (default false)</li>
 * </ul>
 * Invalid values are logged and the default is kept.
 */
public final class CheckerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CheckerConfiguration.class);

    public static final String MAX_STATES = "QCTL_MAX_STATES";
    public static final String THREADS = "QCTL_THREADS";
    public static final String INCLUDE_DEGREE_MAP = "QCTL_INCLUDE_DEGREE_MAP";

    private final int stateLimit;
    private final int threads;
    private final boolean includeDegreeMap;

    public CheckerConfiguration(int stateLimit, int threads, boolean includeDegreeMap) {
        if (stateLimit <= 0) {
            throw new IllegalArgumentException("State limit must be positive: " + stateLimit);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        this.stateLimit = stateLimit;
        this.threads = threads;
        this.includeDegreeMap = includeDegreeMap;
    }

    public static CheckerConfiguration defaults() {
        return new CheckerConfiguration(StateGraphBuilder.DEFAULT_STATE_LIMIT, 1, false);
    }

    public static CheckerConfiguration fromEnvironment() {
        return fromMap(System.getenv());
    }

    public static CheckerConfiguration fromMap(Map<String, String> values) {
        int stateLimit = positiveInt(values, MAX_STATES, StateGraphBuilder.DEFAULT_STATE_LIMIT);
        int threads = positiveInt(values, THREADS, 1);
        boolean degreeMap = false;
        String raw = values.get(INCLUDE_DEGREE_MAP);
        if (raw != null && !raw.isBlank()) {
            String v = raw.trim();
            if (v.equalsIgnoreCase("true") || v.equals("1")) {
                degreeMap = true;
            } else if (!v.equalsIgnoreCase("false") && !v.equals("0")) {
                logger.warn("Invalid {} value '{}' (keeping false)", INCLUDE_DEGREE_MAP, raw);
            }
        }
        return new CheckerConfiguration(stateLimit, threads, degreeMap);
    }

    private static int positiveInt(Map<String, String> values, String key, int fallback) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}' (keeping {})", key, raw, fallback);
            return fallback;
        }
        if (parsed <= 0) {
            logger.warn("{} must be positive, got {} (keeping {})", key, parsed, fallback);
            return fallback;
        }
        return parsed;
    }

    public int getStateLimit() { return stateLimit; }
    public int getThreads() { return threads; }
    public boolean isIncludeDegreeMap() { return includeDegreeMap; }

    public CheckerConfiguration withStateLimit(int limit) {
        return new CheckerConfiguration(limit, threads, includeDegreeMap);
    }

    public CheckerConfiguration withThreads(int count) {
        return new CheckerConfiguration(stateLimit, count, includeDegreeMap);
    }

    public CheckerConfiguration withDegreeMap(boolean include) {
        return new CheckerConfiguration(stateLimit, threads, include);
    }

    @Override
    public String toString() {
        return String.format("CheckerConfiguration{stateLimit=%d, threads=%d, includeDegreeMap=%s}",
                stateLimit, threads, includeDegreeMap);
    }
}
