package com.assoverlay.controllers;

import com.assoverlay.PlaybackService;
import com.assoverlay.SubtitleNotFoundException;
import com.assoverlay.models.ActiveCue;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class PlaybackController implements Controller {

    private final PlaybackService playbackService;

    public PlaybackController(PlaybackService playbackService) {
        this.playbackService = playbackService;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/subtitles/{id}/cues", this::getActiveCues);
    }

    private void getActiveCues(Context ctx) {
        String id = ctx.pathParam("id");
        String t = ctx.queryParam("t");
        if (t == null || t.isBlank()) {
            ctx.status(400).json(Map.of("error", "Query parameter t (milliseconds) is required"));
            return;
        }
        long timestampMs;
        try {
            timestampMs = Long.parseLong(t.trim());
        } catch (NumberFormatException e) {
            ctx.status(400).json(Map.of("error", "Invalid timestamp: " + t));
            return;
        }
        try {
            List<ActiveCue> cues = playbackService.activeCues(id, timestampMs);
            Map<String, Object> payload = new HashMap<>();
            payload.put("t", timestampMs);
            payload.put("cues", cues);
            ctx.json(payload);
        } catch (SubtitleNotFoundException e) {
            ctx.status(404).json(Controller.errorBody(e));
        }
    }
}
