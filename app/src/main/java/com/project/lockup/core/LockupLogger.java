package com.project.lockup.core;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Centralized event log for lockup operations.
 * Writes timestamped lines to the console and appends them to {@code lockup-events.log}
 * (override with the {@code LOCKUP_LOG_FILE} environment variable).
 */
public class LockupLogger {
    private static final String DEFAULT_LOG_FILE = "lockup-events.log";
    private static final ReentrantLock lock = new ReentrantLock();
    private static PrintWriter logWriter;

    static {
        String logFile = System.getenv().getOrDefault("LOCKUP_LOG_FILE", DEFAULT_LOG_FILE);
        try {
            logWriter = new PrintWriter(new FileWriter(logFile, true));
        } catch (IOException e) {
            System.err.println("Failed to initialize lockup logger: " + e.getMessage());
        }
    }

    private LockupLogger() {
    }

    public static void logInfo(String operation, String message) {
        write(System.out, "INFO", operation, message, null);
    }

    /**
     * Log a rejected operation. Rejections are expected outcomes, so no stack trace is printed.
     */
    public static void logRejected(String operation, LockupException rejection) {
        write(System.out, "REJECTED", operation, rejection.getMessage(), null);
    }

    public static void logError(String operation, String message, Throwable error) {
        write(System.err, "ERROR", operation, message, error);
    }

    private static void write(PrintStream console, String level, String operation,
                              String message, Throwable error) {
        lock.lock();
        try {
            String logEntry = String.format("[%s] %s in %s: %s", Instant.now(), level, operation, message);

            console.println(logEntry);
            if (error != null) {
                console.println("  Exception: " + error.getClass().getName());
                console.println("  Message: " + error.getMessage());
                error.printStackTrace(console);
            }

            if (logWriter != null) {
                logWriter.println(logEntry);
                if (error != null) {
                    logWriter.println("  Exception: " + error.getClass().getName());
                    logWriter.println("  Message: " + error.getMessage());
                    error.printStackTrace(logWriter);
                }
                logWriter.flush();
            }
        } finally {
            lock.unlock();
        }
    }
}
