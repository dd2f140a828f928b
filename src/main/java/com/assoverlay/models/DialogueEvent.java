package com.assoverlay.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One timed line from the {@code [Events]} section.
 * {@code displayText} and {@code overrides} are derived from {@code text} when the line is parsed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DialogueEvent {

    private final int index;
    private final Integer layer;
    private final long start;
    private final long end;
    private final String style;
    private final String name;
    private final Integer marginL;
    private final Integer marginR;
    private final Integer marginV;
    private final String effect;
    private final String text;
    private final String displayText;
    private final OverrideSet overrides;

    private DialogueEvent(Builder b) {
        this.index = b.index;
        this.layer = b.layer;
        this.start = b.start;
        this.end = b.end;
        this.style = b.style;
        this.name = b.name;
        this.marginL = b.marginL;
        this.marginR = b.marginR;
        this.marginV = b.marginV;
        this.effect = b.effect;
        this.text = b.text != null ? b.text : "";
        this.displayText = b.displayText != null ? b.displayText : this.text;
        this.overrides = b.overrides != null ? b.overrides : OverrideSet.EMPTY;
    }

    /** Zero-based position of this line among the document's dialogues. */
    public int getIndex() { return index; }
    public Integer getLayer() { return layer; }
    public long getStart() { return start; }
    public long getEnd() { return end; }
    public String getStyle() { return style; }
    public String getName() { return name; }
    public Integer getMarginL() { return marginL; }
    public Integer getMarginR() { return marginR; }
    public Integer getMarginV() { return marginV; }
    public String getEffect() { return effect; }
    public String getText() { return text; }
    public String getDisplayText() { return displayText; }
    public OverrideSet getOverrides() { return overrides; }

    public boolean isActiveAt(long timestampMs) {
        return timestampMs >= start && timestampMs <= end;
    }

    @Override
    public String toString() {
        return "DialogueEvent{" +
            "index=" + index +
            ", start=" + start +
            ", end=" + end +
            ", style='" + style + '\'' +
            ", displayText='" + displayText + '\'' +
            '}';
    }

    public static class Builder {
        private int index;
        private Integer layer;
        private long start;
        private long end;
        private String style;
        private String name;
        private Integer marginL;
        private Integer marginR;
        private Integer marginV;
        private String effect;
        private String text;
        private String displayText;
        private OverrideSet overrides;

        public Builder index(int index) { this.index = index; return this; }
        public Builder layer(Integer layer) { this.layer = layer; return this; }
        public Builder start(long start) { this.start = start; return this; }
        public Builder end(long end) { this.end = end; return this; }
        public Builder style(String style) { this.style = style; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder marginL(Integer marginL) { this.marginL = marginL; return this; }
        public Builder marginR(Integer marginR) { this.marginR = marginR; return this; }
        public Builder marginV(Integer marginV) { this.marginV = marginV; return this; }
        public Builder effect(String effect) { this.effect = effect; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder displayText(String displayText) { this.displayText = displayText; return this; }
        public Builder overrides(OverrideSet overrides) { this.overrides = overrides; return this; }

        public DialogueEvent build() {
            return new DialogueEvent(this);
        }
    }
}
