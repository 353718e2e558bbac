package com.nova.fm.ui;

import com.nova.fm.core.Entry;
import com.nova.fm.core.NavigationHistory;
import com.nova.fm.service.BrowserService;
import com.nova.fm.view.ViewPipeline;
import javafx.scene.Node;
import javafx.scene.control.*;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One side of the browser: navigation bar, optional search field and the entry list
 * fed by its own view pipeline.
 */
public class BrowserPane {

    private final BrowserService service;
    private final NavigationHistory history = new NavigationHistory();
    private final ListView<Entry> listView = new ListView<>();
    private final TextField pathField = new TextField();
    private final TextField searchField = new TextField();
    private final Button backBtn = new Button("<");
    private final Button forwardBtn = new Button(">");
    private final VBox root;
    private final ViewPipeline pipeline;

    public BrowserPane(BrowserService service, Path start, boolean searchable) {
        this.service = service;

        listView.setCellFactory(lv -> new EntryCell(service));
        listView.setOnMouseClicked(event -> {
            if (event.getClickCount() == 2) {
                Entry selected = listView.getSelectionModel().getSelectedItem();
                if (selected == null) return;
                if (selected.isDirectory()) {
                    navigate(selected.getPath(), true);
                } else {
                    Actions.openFile(selected);
                }
            }
        });
        VBox.setVgrow(listView, Priority.ALWAYS);

        this.pipeline = service.openPipeline(start, searchable, this::reload);

        HBox navBar = buildNavBar();
        root = new VBox(4, navBar);
        if (searchable) {
            searchField.setPromptText("Search name or tag");
            searchField.textProperty().addListener((obs, oldV, newV) -> pipeline.setSearchText(newV));
            root.getChildren().add(searchField);
        }
        root.getChildren().add(listView);

        history.push(pipeline.getDirectory());
        reload();
    }

    public Node getNode() {
        return root;
    }

    public void navigate(Path directory, boolean addHistory) {
        searchField.clear();
        pipeline.setDirectory(directory);
        if (addHistory) {
            history.push(pipeline.getDirectory());
        }
        reload();
    }

    public void dispose() {
        service.closePipeline(pipeline);
    }

    private HBox buildNavBar() {
        backBtn.setOnAction(e -> history.back().ifPresent(p -> navigate(p, false)));
        forwardBtn.setOnAction(e -> history.forward().ifPresent(p -> navigate(p, false)));

        Button upBtn = new Button("Up");
        upBtn.setOnAction(e -> {
            Path parent = pipeline.getDirectory().getParent();
            if (parent != null) {
                navigate(parent, true);
            }
        });

        Button refreshBtn = new Button("Refresh");
        refreshBtn.setOnAction(e -> {
            service.getSource().refresh(pipeline.getDirectory());
            pipeline.resort();
        });

        pathField.setOnAction(e -> gotoTypedPath());
        HBox.setHgrow(pathField, Priority.ALWAYS);

        return new HBox(4, backBtn, forwardBtn, upBtn, pathField, refreshBtn);
    }

    private void gotoTypedPath() {
        Path typed;
        try {
            typed = Path.of(pathField.getText().strip());
        } catch (RuntimeException e) {
            Actions.showWarning("Not found", "Invalid path: " + pathField.getText());
            return;
        }
        if (!Files.isDirectory(typed)) {
            Actions.showWarning("Not found", "Path not found: " + typed);
            pathField.setText(String.valueOf(pipeline.getDirectory()));
            return;
        }
        navigate(typed, true);
    }

    private void reload() {
        if (pipeline == null) {
            return; // still under construction
        }
        Path selected = listView.getSelectionModel().getSelectedItem() != null
                ? listView.getSelectionModel().getSelectedItem().getPath()
                : null;

        listView.getItems().setAll(pipeline.entries());
        pathField.setText(String.valueOf(pipeline.getDirectory()));
        backBtn.setDisable(!history.canGoBack());
        forwardBtn.setDisable(!history.canGoForward());

        if (selected != null) {
            pipeline.rowOf(selected).ifPresent(row -> listView.getSelectionModel().select(row));
        }
    }
}
