package com.assoverlay.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Style overrides collected from the inline {@code {\...}} blocks of one dialogue line.
 * A null slot means "inherit from the resolved style".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OverrideSet {

    public static final OverrideSet EMPTY = new Builder().build();

    private final Integer fontSize;
    private final FontWeight fontWeight;
    private final FontStyle fontStyle;
    private final TextDecoration textDecoration;
    private final AssColor color;
    private final Point position;
    private final Integer alignment;

    private OverrideSet(Builder builder) {
        this.fontSize = builder.fontSize;
        this.fontWeight = builder.fontWeight;
        this.fontStyle = builder.fontStyle;
        this.textDecoration = builder.textDecoration;
        this.color = builder.color;
        this.position = builder.position;
        this.alignment = builder.alignment;
    }

    public Integer getFontSize() { return fontSize; }
    public FontWeight getFontWeight() { return fontWeight; }
    public FontStyle getFontStyle() { return fontStyle; }
    public TextDecoration getTextDecoration() { return textDecoration; }
    public AssColor getColor() { return color; }
    public Point getPosition() { return position; }
    public Integer getAlignment() { return alignment; }

    @JsonIgnore
    public boolean isEmpty() {
        return fontSize == null && fontWeight == null && fontStyle == null && textDecoration == null
            && color == null && position == null && alignment == null;
    }

    @Override
    public String toString() {
        return "OverrideSet{" +
            "fontSize=" + fontSize +
            ", fontWeight=" + fontWeight +
            ", fontStyle=" + fontStyle +
            ", textDecoration=" + textDecoration +
            ", color=" + color +
            ", position=" + position +
            ", alignment=" + alignment +
            '}';
    }

    /**
     * Accumulates overrides; a later call for the same slot replaces the earlier value.
     */
    public static class Builder {
        private Integer fontSize;
        private FontWeight fontWeight;
        private FontStyle fontStyle;
        private TextDecoration textDecoration;
        private AssColor color;
        private Point position;
        private Integer alignment;

        public Builder fontSize(Integer fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder fontWeight(FontWeight fontWeight) {
            this.fontWeight = fontWeight;
            return this;
        }

        public Builder fontStyle(FontStyle fontStyle) {
            this.fontStyle = fontStyle;
            return this;
        }

        public Builder textDecoration(TextDecoration textDecoration) {
            this.textDecoration = textDecoration;
            return this;
        }

        public Builder color(AssColor color) {
            this.color = color;
            return this;
        }

        public Builder position(Point position) {
            this.position = position;
            return this;
        }

        public Builder alignment(Integer alignment) {
            this.alignment = alignment;
            return this;
        }

        public OverrideSet build() {
            return new OverrideSet(this);
        }
    }
}
