package com.nova.fm.ui;

import com.nova.fm.config.BrowserSettings;
import com.nova.fm.repo.JsonTagRepository;
import com.nova.fm.service.BrowserService;
import com.nova.fm.source.LocalEntrySource;
import com.nova.fm.util.Bootstrap;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.Label;
import javafx.scene.control.SplitPane;
import javafx.scene.layout.BorderPane;
import javafx.stage.Stage;
import javafx.util.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileBrowserApp extends Application {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileBrowserApp.class);

    private LocalEntrySource source;
    private BrowserPane leftPane;
    private BrowserPane rightPane;
    private Timeline watcher;

    @Override
    public void start(Stage primaryStage) {
        BrowserSettings settings = Bootstrap.resolveSettings(getParameters().getRaw());

        source = new LocalEntrySource();
        JsonTagRepository tags = JsonTagRepository.load(settings.tagsFile());
        BrowserService service = new BrowserService(source, tags);

        leftPane = new BrowserPane(service, settings.startPath(), true);
        rightPane = new BrowserPane(service, settings.secondPath(), false);

        SplitPane split = new SplitPane(leftPane.getNode(), rightPane.getNode());
        split.setDividerPositions(0.5);

        Label status = new Label("Tags: " + tags.getFilePath());

        BorderPane rootPane = new BorderPane();
        rootPane.setCenter(split);
        rootPane.setBottom(status);

        // file-system notifications are handled on the FX thread, between user actions
        watcher = new Timeline(new KeyFrame(Duration.millis(settings.getWatchIntervalMillis()), e -> source.pollChanges()));
        watcher.setCycleCount(Timeline.INDEFINITE);
        watcher.play();

        Scene scene = new Scene(rootPane, 1200, 800);
        primaryStage.setTitle("Nova FM");
        primaryStage.setScene(scene);
        primaryStage.show();

        tags.loadFailure().ifPresent(e -> Actions.showWarning("Tags could not be loaded", e.getMessage()));
        LOGGER.info("Started in {} with tags at {}", settings.startPath(), tags.getFilePath());
    }

    @Override
    public void stop() {
        if (watcher != null) watcher.stop();
        if (leftPane != null) leftPane.dispose();
        if (rightPane != null) rightPane.dispose();
        if (source != null) source.close();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
