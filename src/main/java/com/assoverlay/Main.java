package com.assoverlay;

import com.assoverlay.controllers.Controller;
import com.assoverlay.controllers.PlaybackController;
import com.assoverlay.controllers.SubtitleController;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static SubtitleStore subtitleStore;
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            subtitleStore = new SubtitleStore();
            if (config.getSubtitlePath() != null) {
                preload(config.getSubtitlePath());
            }
            PlaybackService playbackService = new PlaybackService(subtitleStore);

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                    new SubtitleController(subtitleStore),
                    new PlaybackController(playbackService));
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }
            app.get("/api/health", ctx -> ctx.json(Map.of(
                    "version", VERSION,
                    "documents", subtitleStore.size())));

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start ASS Overlay: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  ASS Overlay v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void preload(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            logger.warn("Subtitle file not found, nothing preloaded: " + path);
            return;
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        subtitleStore.load(SubtitleStore.DEFAULT_ID, content);
        logger.info("Preloaded " + path + " as '" + SubtitleStore.DEFAULT_ID + "'");
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(SubtitleNotFoundException.class, (e, ctx) -> {
            logger.warn(e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
