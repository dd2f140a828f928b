package com.assoverlay.controllers;

import com.assoverlay.AppLogger;
import com.assoverlay.SubtitleStore;
import com.assoverlay.models.AssDocument;
import com.assoverlay.models.SubtitleSummary;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;
import java.util.Optional;

/**
 * Loading, listing and removing subtitle documents. The request body of a load is the
 * raw script text.
 */
public class SubtitleController implements Controller {

    private final SubtitleStore store;
    private final AppLogger logger;

    public SubtitleController(SubtitleStore store) {
        this.store = store;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/subtitles", this::listSubtitles);
        app.post("/api/subtitles", this::loadSubtitles);
        app.get("/api/subtitles/{id}", this::getSubtitles);
        app.get("/api/subtitles/{id}/summary", this::getSummary);
        app.delete("/api/subtitles/{id}", this::deleteSubtitles);
    }

    private void listSubtitles(Context ctx) {
        ctx.json(store.list());
    }

    private void loadSubtitles(Context ctx) {
        try {
            String content = ctx.body();
            if (content == null || content.isBlank()) {
                ctx.status(400).json(Map.of("error", "Subtitle text is required"));
                return;
            }
            SubtitleSummary summary = store.load(ctx.queryParam("id"), content);
            ctx.status(201).json(summary);
        } catch (Exception e) {
            if (logger != null) {
                logger.error("Failed to load subtitles: " + e.getMessage(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getSubtitles(Context ctx) {
        String id = ctx.pathParam("id");
        Optional<AssDocument> document = store.getDocument(id);
        if (document.isEmpty()) {
            ctx.status(404).json(Map.of("error", "Subtitle document not found: " + id));
            return;
        }
        ctx.json(document.get());
    }

    private void getSummary(Context ctx) {
        String id = ctx.pathParam("id");
        Optional<SubtitleSummary> summary = store.getSummary(id);
        if (summary.isEmpty()) {
            ctx.status(404).json(Map.of("error", "Subtitle document not found: " + id));
            return;
        }
        ctx.json(summary.get());
    }

    private void deleteSubtitles(Context ctx) {
        String id = ctx.pathParam("id");
        if (!store.remove(id)) {
            ctx.status(404).json(Map.of("error", "Subtitle document not found: " + id));
            return;
        }
        ctx.json(Map.of("removed", id));
    }
}
