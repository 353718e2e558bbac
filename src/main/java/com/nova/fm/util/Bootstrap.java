package com.nova.fm.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nova.fm.config.BrowserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Start-up helpers: locating and loading the settings file.
 */
public class Bootstrap {

    private static final Logger LOGGER = LoggerFactory.getLogger(Bootstrap.class);

    public static final String SETTINGS_PROPERTY = "novafm.settings";
    private static final String SETTINGS_DIR = ".nova-fm";
    private static final String SETTINGS_FILE_NAME = "settings.json";

    public static Path settingsFile() {
        String override = System.getProperty(SETTINGS_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Path.of(override).toAbsolutePath().normalize();
        }
        return Path.of(System.getProperty("user.home"), SETTINGS_DIR, SETTINGS_FILE_NAME);
    }

    /**
     * Reads the settings at {@code file}. A missing file is created with defaults; an
     * unreadable one is left alone and defaults are used for this session.
     */
    public static BrowserSettings loadSettings(Path file) {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        if (Files.exists(file)) {
            try {
                BrowserSettings settings = mapper.readValue(file.toFile(), BrowserSettings.class);
                LOGGER.info("Loaded settings from {}", file);
                return settings != null ? settings : BrowserSettings.defaults();
            } catch (IOException e) {
                LOGGER.warn("Unreadable settings file {}, using defaults: {}", file, e.getMessage());
                return BrowserSettings.defaults();
            }
        }

        BrowserSettings settings = BrowserSettings.defaults();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), settings);
            LOGGER.info("Created default settings at {}", file);
        } catch (IOException e) {
            LOGGER.warn("Could not write default settings to {}: {}", file, e.getMessage());
        }
        return settings;
    }

    /**
     * Settings with the first command-line argument, when present, as start directory.
     */
    public static BrowserSettings resolveSettings(List<String> args) {
        BrowserSettings settings = loadSettings(settingsFile());
        if (!args.isEmpty() && !args.get(0).isBlank()) {
            Path start = Path.of(args.get(0)).toAbsolutePath().normalize();
            if (Files.isDirectory(start)) {
                settings.setStartDirectory(start.toString());
            } else {
                LOGGER.warn("Ignoring start directory {}: not a directory", start);
            }
        }
        return settings;
    }
}
