package com.nova.fm.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.nio.file.Path;

/**
 * User settings, stored as JSON next to the user's home.
 * Mutable so Jackson can bind it directly.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrowserSettings {

    public static final String DEFAULT_TAGS_FILE_NAME = ".tags.json";
    public static final long DEFAULT_WATCH_INTERVAL_MILLIS = 500L;

    private String startDirectory;
    private String secondDirectory;   // right pane, null -> startDirectory
    private String tagsDirectory;     // null -> startDirectory
    private String tagsFileName = DEFAULT_TAGS_FILE_NAME;
    private long watchIntervalMillis = DEFAULT_WATCH_INTERVAL_MILLIS;

    public BrowserSettings() {
        // for Jackson
    }

    public static BrowserSettings defaults() {
        BrowserSettings settings = new BrowserSettings();
        settings.setStartDirectory(System.getProperty("user.home"));
        return settings;
    }

    public String getStartDirectory() {
        return startDirectory;
    }

    public void setStartDirectory(String startDirectory) {
        this.startDirectory = startDirectory;
    }

    public String getSecondDirectory() {
        return secondDirectory;
    }

    public void setSecondDirectory(String secondDirectory) {
        this.secondDirectory = secondDirectory;
    }

    public String getTagsDirectory() {
        return tagsDirectory;
    }

    public void setTagsDirectory(String tagsDirectory) {
        this.tagsDirectory = tagsDirectory;
    }

    public String getTagsFileName() {
        return tagsFileName;
    }

    public void setTagsFileName(String tagsFileName) {
        this.tagsFileName = tagsFileName;
    }

    public long getWatchIntervalMillis() {
        return watchIntervalMillis;
    }

    public void setWatchIntervalMillis(long watchIntervalMillis) {
        this.watchIntervalMillis = watchIntervalMillis;
    }

    // ---------- Resolved values ----------

    public Path startPath() {
        String dir = startDirectory != null && !startDirectory.isBlank()
                ? startDirectory
                : System.getProperty("user.home");
        return Path.of(dir).toAbsolutePath().normalize();
    }

    public Path secondPath() {
        if (secondDirectory == null || secondDirectory.isBlank()) {
            return startPath();
        }
        return Path.of(secondDirectory).toAbsolutePath().normalize();
    }

    public Path tagsFile() {
        Path dir = tagsDirectory != null && !tagsDirectory.isBlank()
                ? Path.of(tagsDirectory).toAbsolutePath().normalize()
                : startPath();
        String name = tagsFileName != null && !tagsFileName.isBlank() ? tagsFileName : DEFAULT_TAGS_FILE_NAME;
        return dir.resolve(name);
    }
}
