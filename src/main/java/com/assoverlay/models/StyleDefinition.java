package com.assoverlay.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A named typographic preset from a {@code [V4+ Styles]} section.
 * Numeric attributes are null when the source row did not carry a parseable value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StyleDefinition {

    private final String name;
    private final String fontName;
    private final Double fontSize;
    private final AssColor primaryColor;
    private final AssColor secondaryColor;
    private final AssColor outlineColor;
    private final AssColor backColor;
    private final boolean bold;
    private final boolean italic;
    private final boolean underline;
    private final boolean strikeout;
    private final Double scaleX;
    private final Double scaleY;
    private final Double spacing;
    private final Double angle;
    private final Integer borderStyle;
    private final Double outline;
    private final Double shadow;
    private final Integer alignment;
    private final Integer marginL;
    private final Integer marginR;
    private final Integer marginV;
    private final Integer encoding;

    private StyleDefinition(Builder b) {
        this.name = b.name;
        this.fontName = b.fontName;
        this.fontSize = b.fontSize;
        this.primaryColor = orWhite(b.primaryColor);
        this.secondaryColor = orWhite(b.secondaryColor);
        this.outlineColor = orWhite(b.outlineColor);
        this.backColor = orWhite(b.backColor);
        this.bold = b.bold;
        this.italic = b.italic;
        this.underline = b.underline;
        this.strikeout = b.strikeout;
        this.scaleX = b.scaleX;
        this.scaleY = b.scaleY;
        this.spacing = b.spacing;
        this.angle = b.angle;
        this.borderStyle = b.borderStyle;
        this.outline = b.outline;
        this.shadow = b.shadow;
        this.alignment = b.alignment;
        this.marginL = b.marginL;
        this.marginR = b.marginR;
        this.marginV = b.marginV;
        this.encoding = b.encoding;
    }

    private static AssColor orWhite(AssColor color) {
        return color != null ? color : AssColor.WHITE;
    }

    public String getName() { return name; }
    public String getFontName() { return fontName; }
    public Double getFontSize() { return fontSize; }
    public AssColor getPrimaryColor() { return primaryColor; }
    public AssColor getSecondaryColor() { return secondaryColor; }
    public AssColor getOutlineColor() { return outlineColor; }
    public AssColor getBackColor() { return backColor; }
    public boolean isBold() { return bold; }
    public boolean isItalic() { return italic; }
    public boolean isUnderline() { return underline; }
    public boolean isStrikeout() { return strikeout; }
    public Double getScaleX() { return scaleX; }
    public Double getScaleY() { return scaleY; }
    public Double getSpacing() { return spacing; }
    public Double getAngle() { return angle; }
    public Integer getBorderStyle() { return borderStyle; }
    public Double getOutline() { return outline; }
    public Double getShadow() { return shadow; }
    public Integer getAlignment() { return alignment; }
    public Integer getMarginL() { return marginL; }
    public Integer getMarginR() { return marginR; }
    public Integer getMarginV() { return marginV; }
    public Integer getEncoding() { return encoding; }

    @Override
    public String toString() {
        return "StyleDefinition{" +
            "name='" + name + '\'' +
            ", fontName='" + fontName + '\'' +
            ", fontSize=" + fontSize +
            ", alignment=" + alignment +
            '}';
    }

    public static class Builder {
        private String name;
        private String fontName;
        private Double fontSize;
        private AssColor primaryColor;
        private AssColor secondaryColor;
        private AssColor outlineColor;
        private AssColor backColor;
        private boolean bold;
        private boolean italic;
        private boolean underline;
        private boolean strikeout;
        private Double scaleX;
        private Double scaleY;
        private Double spacing;
        private Double angle;
        private Integer borderStyle;
        private Double outline;
        private Double shadow;
        private Integer alignment;
        private Integer marginL;
        private Integer marginR;
        private Integer marginV;
        private Integer encoding;

        public Builder name(String name) { this.name = name; return this; }
        public Builder fontName(String fontName) { this.fontName = fontName; return this; }
        public Builder fontSize(Double fontSize) { this.fontSize = fontSize; return this; }
        public Builder primaryColor(AssColor color) { this.primaryColor = color; return this; }
        public Builder secondaryColor(AssColor color) { this.secondaryColor = color; return this; }
        public Builder outlineColor(AssColor color) { this.outlineColor = color; return this; }
        public Builder backColor(AssColor color) { this.backColor = color; return this; }
        public Builder bold(boolean bold) { this.bold = bold; return this; }
        public Builder italic(boolean italic) { this.italic = italic; return this; }
        public Builder underline(boolean underline) { this.underline = underline; return this; }
        public Builder strikeout(boolean strikeout) { this.strikeout = strikeout; return this; }
        public Builder scaleX(Double scaleX) { this.scaleX = scaleX; return this; }
        public Builder scaleY(Double scaleY) { this.scaleY = scaleY; return this; }
        public Builder spacing(Double spacing) { this.spacing = spacing; return this; }
        public Builder angle(Double angle) { this.angle = angle; return this; }
        public Builder borderStyle(Integer borderStyle) { this.borderStyle = borderStyle; return this; }
        public Builder outline(Double outline) { this.outline = outline; return this; }
        public Builder shadow(Double shadow) { this.shadow = shadow; return this; }
        public Builder alignment(Integer alignment) { this.alignment = alignment; return this; }
        public Builder marginL(Integer marginL) { this.marginL = marginL; return this; }
        public Builder marginR(Integer marginR) { this.marginR = marginR; return this; }
        public Builder marginV(Integer marginV) { this.marginV = marginV; return this; }
        public Builder encoding(Integer encoding) { this.encoding = encoding; return this; }

        public StyleDefinition build() {
            return new StyleDefinition(this);
        }
    }
}
