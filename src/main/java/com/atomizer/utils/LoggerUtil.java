/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Timestamped console logger shared by the compiler, validator and CLI.
 *
 * <p>Lines are written to stdout as {@code [timestamp][LEVEL] message}. Callers prefix
 * messages with their component name, e.g. {@code [DifferentialValidator]}.</p>
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;

    public static void log(String level, String msg) {
        if (silent) return;
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "] " + msg;
        synchronized (LoggerUtil.class) {
            System.out.println(line);
        }
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled && !silent) {
            log("DEBUG", msgSupplier.get());
        }
    }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    /**
     * Applies the {@code log.debug} setting from a loaded configuration.
     */
    public static void configure(Properties properties) {
        setDebugEnabled(Boolean.parseBoolean(properties.getProperty("log.debug", "false").trim()));
    }

    private LoggerUtil() {}
}
