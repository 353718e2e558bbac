package com.nova.fm.core;

import com.nova.fm.exception.EntryOperationException;
import com.nova.fm.exception.RenameConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Enabled/disabled naming convention.
 * A disabled entry carries the literal {@value #MARKER} prefix on its base name
 * (matched case-insensitively, written in canonical case).
 * <p>
 * Stripping the marker also trims every leading and trailing underscore, so a name
 * such as {@code _init_} comes back from a double toggle as {@code init}.
 */
public final class NameCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(NameCodec.class);

    public static final String MARKER = "DISABLED_";

    private NameCodec() {
    }

    public static boolean isDisabled(String rawName) {
        return rawName != null && rawName.toUpperCase(Locale.ROOT).startsWith(MARKER);
    }

    public static String effectiveName(String rawName) {
        String name = isDisabled(rawName) ? rawName.substring(MARKER.length()) : rawName;
        return stripUnderscores(name);
    }

    public static String toggledName(String rawName) {
        if (isDisabled(rawName)) {
            return stripUnderscores(rawName.substring(MARKER.length()));
        }
        return MARKER + rawName;
    }

    /**
     * Renames the entry at {@code path} to its toggled name in the same directory.
     *
     * @return the new path
     * @throws RenameConflictException if a sibling already has the target name
     * @throws EntryOperationException on any other failure; the entry is left untouched
     */
    public static Path toggle(Path path) throws EntryOperationException {
        Path fileName = path.getFileName();
        if (fileName == null) {
            throw new EntryOperationException(path, "cannot toggle a root directory");
        }
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new EntryOperationException(path, "entry does not exist");
        }

        String newName = toggledName(fileName.toString());
        if (newName.isEmpty()) {
            throw new EntryOperationException(path, "toggled name would be empty");
        }

        Path target = path.resolveSibling(newName);
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new RenameConflictException(path, target);
        }

        try {
            Files.move(path, target);
        } catch (FileAlreadyExistsException e) {
            throw new RenameConflictException(path, target);
        } catch (IOException e) {
            throw new EntryOperationException(path, "rename to " + newName + " failed: " + e.getMessage(), e);
        }

        LOGGER.debug("Toggled {} -> {}", path, target);
        return target;
    }

    private static String stripUnderscores(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && name.charAt(start) == '_') start++;
        while (end > start && name.charAt(end - 1) == '_') end--;
        return name.substring(start, end);
    }
}
