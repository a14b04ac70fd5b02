package org.surn.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress logging of the compiler phases, gated by the {@code surn.compiler.verbosity} setting.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * Problems in the compiled source are not logged here; they go to the {@link DiagnosticsEngine}
 * and are rendered as reports. A message that passes the verbosity gate is handed to SLF4J,
 * where the Logback level of this class applies as well.
 */
public final class CompilerLogger {

    /** Lowest verbosity; only reports reach the user. */
    public static final int ERROR = 0;
    public static final int WARN  = 1;
    /** Phase summaries. */
    public static final int INFO  = 2;
    /** Log level for parser and phase details. */
    public static final int DEBUG = 3;
    /** Log level for per-token output. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * Sets the verbosity. Values outside 0..4 are clamped.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity.
     */
    public static int getLevel() { return level; }

    /**
     * Logs a summary line of a compilation phase.
     * @param msg The message to log.
     */
    public static void info(String msg) {
        if (level >= INFO) logger.info(msg);
    }

    /**
     * Logs a debug message.
     * @param msg The message to log.
     */
    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    /**
     * Logs a trace message.
     * @param msg The message to log.
     */
    public static void trace(String msg) {
        if (level >= TRACE) logger.trace(msg);
    }
}
