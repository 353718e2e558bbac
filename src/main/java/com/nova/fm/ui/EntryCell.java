package com.nova.fm.ui;

import com.nova.fm.core.Entry;
import com.nova.fm.service.BrowserService;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.ContextMenu;
import javafx.scene.control.Label;
import javafx.scene.control.ListCell;
import javafx.scene.control.MenuItem;
import javafx.scene.control.SeparatorMenuItem;
import javafx.scene.layout.HBox;
import javafx.scene.layout.StackPane;
import javafx.scene.layout.VBox;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Row of a pane: state badge (click to toggle), effective name, tags and metadata.
 */
public class EntryCell extends ListCell<Entry> {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());

    private final BrowserService service;

    private final StackPane badge = new StackPane();
    private final Label badgeLabel = new Label();
    private final Label nameLabel = new Label();
    private final Label tagsLabel = new Label();
    private final Label metaLabel = new Label();
    private final HBox content;

    public EntryCell(BrowserService service) {
        this.service = service;

        badge.setPrefSize(40, 40);
        badge.setMinSize(40, 40);
        badge.getChildren().add(badgeLabel);
        badgeLabel.setStyle("-fx-text-fill: white; -fx-font-weight: bold;");
        badge.setOnMouseClicked(event -> {
            Entry entry = getItem();
            if (entry != null) {
                Actions.toggle(service, entry.getPath());
            }
            event.consume();
        });

        nameLabel.setStyle("-fx-font-weight: bold;");
        tagsLabel.setStyle("-fx-text-fill: #4a78b0; -fx-font-size: 0.85em;");
        metaLabel.setStyle("-fx-text-fill: gray; -fx-font-size: 0.85em;");

        VBox text = new VBox(2, nameLabel, tagsLabel, metaLabel);
        content = new HBox(8, badge, text);
        content.setAlignment(Pos.CENTER_LEFT);
        content.setPadding(new Insets(4));
    }

    @Override
    protected void updateItem(Entry entry, boolean empty) {
        super.updateItem(entry, empty);
        if (empty || entry == null) {
            setGraphic(null);
            setContextMenu(null);
            return;
        }

        boolean disabled = entry.isDisabled();
        badge.setStyle(disabled ? "-fx-background-color: #8b2323;" : "-fx-background-color: #226622;");
        badgeLabel.setText(entry.isDirectory() ? "DIR" : "FILE");

        nameLabel.setText(entry.getEffectiveName());
        nameLabel.setOpacity(disabled ? 0.6 : 1.0);

        List<String> tags = service.tagsOf(entry.getPath());
        tagsLabel.setText(tags.stream().map(t -> "#" + t).collect(Collectors.joining(" ")));
        tagsLabel.setManaged(!tags.isEmpty());
        tagsLabel.setVisible(!tags.isEmpty());

        String modified = entry.getModifiedTime() != null
                ? DATE_FORMAT.format(entry.getModifiedTime().toInstant())
                : "";
        if (!entry.exists()) {
            metaLabel.setText("(gone)");
        } else {
            metaLabel.setText(entry.isDirectory() ? modified : humanSize(entry.getSize()) + "  " + modified);
        }

        setText(null);
        setGraphic(content);
        setContextMenu(buildContextMenu(entry, tags));
    }

    private ContextMenu buildContextMenu(Entry entry, List<String> tags) {
        ContextMenu menu = new ContextMenu();

        MenuItem toggle = new MenuItem(entry.isDisabled() ? "Enable" : "Disable");
        toggle.setOnAction(e -> Actions.toggle(service, entry.getPath()));

        MenuItem addTag = new MenuItem("Add Tag");
        addTag.setOnAction(e -> Actions.addTagDialog(service, entry.getPath()));
        menu.getItems().addAll(toggle, new SeparatorMenuItem(), addTag);

        if (!tags.isEmpty()) {
            menu.getItems().add(new SeparatorMenuItem());
            for (String tag : tags) {
                MenuItem remove = new MenuItem("Remove: " + tag);
                remove.setOnAction(e -> Actions.removeTag(service, entry.getPath(), tag));
                menu.getItems().add(remove);
            }
            MenuItem removeAll = new MenuItem("Remove all tags");
            removeAll.setOnAction(e -> Actions.clearTags(service, entry.getPath()));
            menu.getItems().add(removeAll);
        }
        return menu;
    }

    private static String humanSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        double kb = bytes / 1024.0;
        if (kb < 1024) return String.format("%.1f KB", kb);
        double mb = kb / 1024.0;
        if (mb < 1024) return String.format("%.1f MB", mb);
        return String.format("%.1f GB", mb / 1024.0);
    }
}
