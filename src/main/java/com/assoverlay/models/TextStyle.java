package com.assoverlay.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Flat text attributes of a resolved dialogue line, independent of any rendering surface.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TextStyle {

    private final String fontFamily;
    private final AssColor color;
    private final double fontSize;
    private final FontWeight fontWeight;
    private final FontStyle fontStyle;
    private final TextDecoration textDecoration;
    private final double letterSpacing;
    private final AssColor shadowColor;
    private final double shadowRadius;
    private final double shadowOffsetX;
    private final double shadowOffsetY;
    private final TextAlign textAlign;

    public TextStyle(String fontFamily, AssColor color, double fontSize, FontWeight fontWeight,
                     FontStyle fontStyle, TextDecoration textDecoration, double letterSpacing,
                     AssColor shadowColor, double shadowRadius, double shadowOffsetX,
                     double shadowOffsetY, TextAlign textAlign) {
        this.fontFamily = fontFamily;
        this.color = color;
        this.fontSize = fontSize;
        this.fontWeight = fontWeight;
        this.fontStyle = fontStyle;
        this.textDecoration = textDecoration;
        this.letterSpacing = letterSpacing;
        this.shadowColor = shadowColor;
        this.shadowRadius = shadowRadius;
        this.shadowOffsetX = shadowOffsetX;
        this.shadowOffsetY = shadowOffsetY;
        this.textAlign = textAlign;
    }

    public String getFontFamily() { return fontFamily; }
    public AssColor getColor() { return color; }
    public double getFontSize() { return fontSize; }
    public FontWeight getFontWeight() { return fontWeight; }
    public FontStyle getFontStyle() { return fontStyle; }
    public TextDecoration getTextDecoration() { return textDecoration; }
    public double getLetterSpacing() { return letterSpacing; }
    public AssColor getShadowColor() { return shadowColor; }
    public double getShadowRadius() { return shadowRadius; }
    public double getShadowOffsetX() { return shadowOffsetX; }
    public double getShadowOffsetY() { return shadowOffsetY; }
    public TextAlign getTextAlign() { return textAlign; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextStyle)) return false;
        TextStyle other = (TextStyle) o;
        return Double.compare(fontSize, other.fontSize) == 0
            && Double.compare(letterSpacing, other.letterSpacing) == 0
            && Double.compare(shadowRadius, other.shadowRadius) == 0
            && Double.compare(shadowOffsetX, other.shadowOffsetX) == 0
            && Double.compare(shadowOffsetY, other.shadowOffsetY) == 0
            && Objects.equals(fontFamily, other.fontFamily)
            && Objects.equals(color, other.color)
            && fontWeight == other.fontWeight
            && fontStyle == other.fontStyle
            && textDecoration == other.textDecoration
            && Objects.equals(shadowColor, other.shadowColor)
            && textAlign == other.textAlign;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fontFamily, color, fontSize, fontWeight, fontStyle, textDecoration,
            letterSpacing, shadowColor, shadowRadius, shadowOffsetX, shadowOffsetY, textAlign);
    }

    @Override
    public String toString() {
        return "TextStyle{" +
            "color=" + color +
            ", fontSize=" + fontSize +
            ", fontWeight=" + fontWeight +
            ", fontStyle=" + fontStyle +
            ", textDecoration=" + textDecoration +
            ", textAlign=" + textAlign +
            '}';
    }
}
