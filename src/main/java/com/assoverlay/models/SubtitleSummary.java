package com.assoverlay.models;

public class SubtitleSummary {

    private String id;
    private String title;
    private int styleCount;
    private int dialogueCount;
    private long durationMs;
    private long loadedAt;

    public SubtitleSummary() {
    }

    public SubtitleSummary(String id, String title, int styleCount, int dialogueCount,
                           long durationMs, long loadedAt) {
        this.id = id;
        this.title = title;
        this.styleCount = styleCount;
        this.dialogueCount = dialogueCount;
        this.durationMs = durationMs;
        this.loadedAt = loadedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public int getStyleCount() {
        return styleCount;
    }

    public void setStyleCount(int styleCount) {
        this.styleCount = styleCount;
    }

    public int getDialogueCount() {
        return dialogueCount;
    }

    public void setDialogueCount(int dialogueCount) {
        this.dialogueCount = dialogueCount;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public long getLoadedAt() {
        return loadedAt;
    }

    public void setLoadedAt(long loadedAt) {
        this.loadedAt = loadedAt;
    }

    @Override
    public String toString() {
        return "SubtitleSummary{" +
            "id='" + id + '\'' +
            ", title='" + title + '\'' +
            ", styleCount=" + styleCount +
            ", dialogueCount=" + dialogueCount +
            ", durationMs=" + durationMs +
            '}';
    }
}
