/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.config;

import com.atomizer.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Layered configuration: classpath {@code atomizer.properties} defaults, then an optional
 * external properties file, then JVM system properties for keys already known.
 */
public final class AtomizerConfig {

    public static final String RESOURCE = "atomizer.properties";
    public static final Path DEFAULT_EXTERNAL = Path.of(RESOURCE);

    private AtomizerConfig() {}

    /**
     * Load configuration with {@code ./atomizer.properties} as the external override file.
     */
    public static Properties load() throws IOException {
        return load(DEFAULT_EXTERNAL, false);
    }

    /**
     * Load configuration with an explicitly named override file.
     *
     * @param externalFile override file; null for none
     * @throws IOException if the classpath defaults are missing, or the override file
     *                     does not exist or cannot be read
     */
    public static Properties load(Path externalFile) throws IOException {
        return load(externalFile, true);
    }

    private static Properties load(Path externalFile, boolean required) throws IOException {
        Properties config = new Properties();

        try (InputStream inputStream = AtomizerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (inputStream == null) {
                throw new IOException(RESOURCE + " not found in classpath");
            }
            config.load(inputStream);
            LoggerUtil.debug("[AtomizerConfig] Loaded classpath configuration as defaults");
        }

        if (externalFile != null) {
            if (Files.exists(externalFile)) {
                try (InputStream inputStream = Files.newInputStream(externalFile)) {
                    Properties externalConfig = new Properties();
                    externalConfig.load(inputStream);
                    config.putAll(externalConfig);
                    LoggerUtil.info("[AtomizerConfig] Loaded configuration overrides from "
                            + externalFile.toAbsolutePath() + " (" + externalConfig.size() + " properties)");
                } catch (IOException e) {
                    if (required) {
                        throw e;
                    }
                    LoggerUtil.warn("[AtomizerConfig] Failed to load configuration overrides: " + e.getMessage());
                }
            } else if (required) {
                throw new NoSuchFileException(externalFile.toString(), null, "configuration file not found");
            }
        }

        for (String key : config.stringPropertyNames()) {
            String systemValue = System.getProperty(key);
            if (systemValue != null) {
                config.setProperty(key, systemValue);
            }
        }

        LoggerUtil.configure(config);
        return config;
    }

    /**
     * Read an int setting, falling back to the default when absent or blank.
     *
     * @throws IllegalArgumentException if the value is not an integer
     */
    public static int getInt(Properties config, String key, int defaultValue) {
        String value = config.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }
}
