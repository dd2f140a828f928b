package com.assoverlay;

import com.assoverlay.models.AssDocument;
import com.assoverlay.models.SubtitleSummary;
import com.assoverlay.subtitles.DialogueTimeline;
import com.assoverlay.subtitles.DocumentParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of parsed subtitle documents, each with its timeline index.
 */
public class SubtitleStore {

    public static final String DEFAULT_ID = "default";

    private final DocumentParser parser;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public SubtitleStore() {
        this(new DocumentParser());
    }

    public SubtitleStore(DocumentParser parser) {
        this.parser = parser != null ? parser : new DocumentParser();
    }

    /**
     * Parses {@code content} and stores it under {@code id}, replacing any document with
     * the same id. A null or blank id gets a generated one.
     */
    public SubtitleSummary load(String id, String content) {
        String key = id == null || id.isBlank() ? UUID.randomUUID().toString() : id.trim();
        AssDocument document = parser.parse(content);
        SubtitleSummary summary = new SubtitleSummary(
            key,
            document.getTitle(),
            document.getStyles().size(),
            document.getDialogues().size(),
            document.getDurationMs(),
            System.currentTimeMillis());
        Entry previous = entries.put(key, new Entry(summary, document, new DialogueTimeline(document)));
        log((previous != null ? "Replaced" : "Loaded") + " subtitle document " + key
            + " (" + summary.getDialogueCount() + " dialogue(s))");
        return summary;
    }

    public List<SubtitleSummary> list() {
        List<SubtitleSummary> results = new ArrayList<>();
        for (Entry entry : entries.values()) {
            results.add(entry.summary);
        }
        results.sort(Comparator.comparingLong(SubtitleSummary::getLoadedAt).thenComparing(SubtitleSummary::getId));
        return results;
    }

    public Optional<SubtitleSummary> getSummary(String id) {
        return find(id).map(entry -> entry.summary);
    }

    public Optional<AssDocument> getDocument(String id) {
        return find(id).map(entry -> entry.document);
    }

    public Optional<DialogueTimeline> getTimeline(String id) {
        return find(id).map(entry -> entry.timeline);
    }

    public boolean remove(String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        boolean removed = entries.remove(id) != null;
        if (removed) {
            log("Removed subtitle document " + id);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private Optional<Entry> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(id));
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[SubtitleStore] " + message);
        } else {
            System.out.println("[SubtitleStore] " + message);
        }
    }

    private static final class Entry {
        private final SubtitleSummary summary;
        private final AssDocument document;
        private final DialogueTimeline timeline;

        private Entry(SubtitleSummary summary, AssDocument document, DialogueTimeline timeline) {
            this.summary = summary;
            this.document = document;
            this.timeline = timeline;
        }
    }
}
