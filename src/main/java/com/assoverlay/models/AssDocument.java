package com.assoverlay.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed subtitle script: metadata, named styles and dialogue lines in source order.
 * Instances are immutable.
 */
public final class AssDocument {

    public static final String KEY_TITLE = "Title";
    public static final String KEY_PLAY_RES_X = "PlayResX";
    public static final String KEY_PLAY_RES_Y = "PlayResY";

    private final Map<String, String> scriptInfo;
    private final Map<String, StyleDefinition> styles;
    private final List<DialogueEvent> dialogues;

    public AssDocument(Map<String, String> scriptInfo,
                       Map<String, StyleDefinition> styles,
                       List<DialogueEvent> dialogues) {
        this.scriptInfo = scriptInfo == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(scriptInfo));
        this.styles = styles == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
        this.dialogues = dialogues == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(dialogues));
    }

    public static AssDocument empty() {
        return new AssDocument(null, null, null);
    }

    public Map<String, String> getScriptInfo() { return scriptInfo; }
    public Map<String, StyleDefinition> getStyles() { return styles; }
    public List<DialogueEvent> getDialogues() { return dialogues; }

    public String getScriptInfo(String key) {
        return key != null ? scriptInfo.get(key) : null;
    }

    public StyleDefinition getStyle(String name) {
        return name != null ? styles.get(name) : null;
    }

    @JsonIgnore
    public String getTitle() {
        return scriptInfo.get(KEY_TITLE);
    }

    @JsonIgnore
    public Integer getPlayResX() {
        return parseResolution(scriptInfo.get(KEY_PLAY_RES_X));
    }

    @JsonIgnore
    public Integer getPlayResY() {
        return parseResolution(scriptInfo.get(KEY_PLAY_RES_Y));
    }

    /**
     * End time of the last-ending dialogue, or 0 for a document without dialogue.
     */
    @JsonIgnore
    public long getDurationMs() {
        long max = 0;
        for (DialogueEvent dialogue : dialogues) {
            max = Math.max(max, dialogue.getEnd());
        }
        return max;
    }

    private static Integer parseResolution(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
