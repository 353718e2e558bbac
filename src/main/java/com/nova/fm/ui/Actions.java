package com.nova.fm.ui;

import com.nova.fm.core.Entry;
import com.nova.fm.exception.EntryOperationException;
import com.nova.fm.exception.RenameConflictException;
import com.nova.fm.exception.TagPersistException;
import com.nova.fm.service.BrowserService;
import javafx.scene.control.Alert;
import javafx.scene.control.TextInputDialog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * User actions issued from a pane. Everything goes by path, never by row.
 */
public class Actions {

    private static final Logger LOGGER = LoggerFactory.getLogger(Actions.class);

    public static void toggle(BrowserService service, Path path) {
        try {
            service.toggle(path);
        } catch (TagPersistException e) {
            showPersistFailure(e);
        } catch (RenameConflictException e) {
            showError("Cannot toggle " + path.getFileName(),
                    "An entry named " + e.getTarget().getFileName() + " already exists.");
        } catch (EntryOperationException e) {
            LOGGER.warn("Toggle failed: {}", e.getMessage());
            showError("Cannot toggle " + path.getFileName(), e.getMessage());
        }
    }

    public static void addTagDialog(BrowserService service, Path path) {
        TextInputDialog dialog = new TextInputDialog();
        dialog.setTitle("Add Tag");
        dialog.setHeaderText("Tag " + path.getFileName());
        dialog.setContentText("Tag name:");
        dialog.showAndWait().ifPresent(tag -> {
            try {
                service.addTag(path, tag);
            } catch (TagPersistException e) {
                showPersistFailure(e);
            }
        });
    }

    public static void removeTag(BrowserService service, Path path, String tag) {
        try {
            service.removeTag(path, tag);
        } catch (TagPersistException e) {
            showPersistFailure(e);
        }
    }

    public static void clearTags(BrowserService service, Path path) {
        try {
            service.clearTags(path);
        } catch (TagPersistException e) {
            showPersistFailure(e);
        }
    }

    public static void openFile(Entry entry) {
        if (entry == null) {
            return;
        }

        File f = entry.getPath().toFile();
        if (!f.exists()) {
            LOGGER.info("Entry no longer exists: {}", f);
            return;
        }

        if (!Desktop.isDesktopSupported()) {
            LOGGER.info("Desktop API not supported, cannot open {}", f);
            return;
        }

        try {
            Desktop.getDesktop().open(f);
        } catch (IOException | UnsupportedOperationException e) {
            LOGGER.warn("Failed to open {}: {}", f, e.getMessage());
            showError("Cannot open " + f.getName(), e.getMessage());
        }
    }

    public static void showWarning(String header, String message) {
        Alert alert = new Alert(Alert.AlertType.WARNING, message);
        alert.setHeaderText(header);
        alert.show();
    }

    public static void showError(String header, String message) {
        Alert alert = new Alert(Alert.AlertType.ERROR, message);
        alert.setHeaderText(header);
        alert.showAndWait();
    }

    private static void showPersistFailure(TagPersistException e) {
        showError("Tags not saved", e.getMessage() + "\nThe change is kept for this session.");
    }
}
