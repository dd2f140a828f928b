package com.assoverlay.models;

import java.util.Objects;

/**
 * Output of the style cascade for one dialogue line.
 */
public final class ResolvedStyle {
    private final TextStyle textStyle;
    private final Position position;

    public ResolvedStyle(TextStyle textStyle, Position position) {
        this.textStyle = textStyle;
        this.position = position;
    }

    public TextStyle getTextStyle() { return textStyle; }
    public Position getPosition() { return position; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedStyle)) return false;
        ResolvedStyle other = (ResolvedStyle) o;
        return Objects.equals(textStyle, other.textStyle) && Objects.equals(position, other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(textStyle, position);
    }

    @Override
    public String toString() {
        return "ResolvedStyle{textStyle=" + textStyle + ", position=" + position + '}';
    }
}
