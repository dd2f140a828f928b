package com.assoverlay.subtitles;

import com.assoverlay.models.AssColor;
import com.assoverlay.models.AssDocument;
import com.assoverlay.models.DialogueEvent;
import com.assoverlay.models.FontStyle;
import com.assoverlay.models.FontWeight;
import com.assoverlay.models.HorizontalAnchor;
import com.assoverlay.models.OverrideSet;
import com.assoverlay.models.Position;
import com.assoverlay.models.ResolvedStyle;
import com.assoverlay.models.StyleDefinition;
import com.assoverlay.models.TextAlign;
import com.assoverlay.models.TextDecoration;
import com.assoverlay.models.TextStyle;
import com.assoverlay.models.VerticalAnchor;

/**
 * Merges a dialogue line's named style, its inline overrides and its alignment into a
 * final text style and screen position.
 * <p>
 * Precedence, lowest first: built-in defaults, the named style, the line's overrides.
 * An explicit {@code \pos} replaces whatever position the alignment produced.
 */
public class StyleResolver {

    public static final double DEFAULT_FONT_SIZE = 24;
    public static final int DEFAULT_MARGIN = 20;
    public static final int DEFAULT_ALIGNMENT = 2;
    public static final double CENTER_OFFSET_X = -50;
    public static final double SHADOW_OFFSET = 1;

    public ResolvedStyle resolve(AssDocument document, DialogueEvent dialogue) {
        if (document == null || dialogue == null) {
            throw new IllegalArgumentException("Document and dialogue are required");
        }
        StyleDefinition base = document.getStyle(dialogue.getStyle());
        OverrideSet overrides = dialogue.getOverrides();

        AssColor color = base != null ? base.getPrimaryColor() : AssColor.WHITE;
        double fontSize = base != null && isPositive(base.getFontSize()) ? base.getFontSize() : DEFAULT_FONT_SIZE;
        FontWeight fontWeight = base != null && base.isBold() ? FontWeight.BOLD : FontWeight.NORMAL;
        FontStyle fontStyle = base != null && base.isItalic() ? FontStyle.ITALIC : FontStyle.NORMAL;
        TextDecoration decoration = base != null && base.isUnderline() ? TextDecoration.UNDERLINE : TextDecoration.NONE;

        if (overrides.getFontWeight() != null) {
            fontWeight = overrides.getFontWeight();
        }
        if (overrides.getFontStyle() != null) {
            fontStyle = overrides.getFontStyle();
        }
        if (overrides.getTextDecoration() != null) {
            decoration = overrides.getTextDecoration();
        }
        if (overrides.getFontSize() != null && overrides.getFontSize() > 0) {
            fontSize = overrides.getFontSize();
        }
        if (overrides.getColor() != null) {
            color = overrides.getColor();
        }

        int alignment = effectiveAlignment(overrides, base);
        VerticalAnchor vertical = VerticalAnchor.fromAlignment(alignment);
        HorizontalAnchor horizontal = HorizontalAnchor.fromAlignment(alignment);

        TextStyle textStyle = new TextStyle(
            base != null ? base.getFontName() : null,
            color,
            fontSize,
            fontWeight,
            fontStyle,
            decoration,
            base != null && base.getSpacing() != null ? base.getSpacing() : 0,
            base != null ? base.getOutlineColor() : AssColor.SHADOW_DEFAULT,
            base != null && base.getShadow() != null ? base.getShadow() : 0,
            SHADOW_OFFSET,
            SHADOW_OFFSET,
            textAlign(horizontal));

        Position position;
        if (overrides.getPosition() != null) {
            position = Position.absolute(overrides.getPosition().getX(), overrides.getPosition().getY());
        } else {
            int verticalMargin = margin(dialogue.getMarginV(), base != null ? base.getMarginV() : null);
            int horizontalMargin;
            if (horizontal == HorizontalAnchor.LEFT) {
                horizontalMargin = margin(dialogue.getMarginL(), base != null ? base.getMarginL() : null);
            } else if (horizontal == HorizontalAnchor.RIGHT) {
                horizontalMargin = margin(dialogue.getMarginR(), base != null ? base.getMarginR() : null);
            } else {
                horizontalMargin = 0;
            }
            double offsetX = horizontal == HorizontalAnchor.CENTER ? CENTER_OFFSET_X : 0;
            double offsetY = vertical == VerticalAnchor.MIDDLE ? -fontSize / 2 : 0;
            position = Position.anchored(vertical, verticalMargin, horizontal, horizontalMargin, offsetX, offsetY);
        }
        return new ResolvedStyle(textStyle, position);
    }

    /**
     * Override, then style, then bottom-center. A value of 0 counts as unset.
     */
    static int effectiveAlignment(OverrideSet overrides, StyleDefinition base) {
        if (isSet(overrides.getAlignment())) {
            return overrides.getAlignment();
        }
        if (base != null && isSet(base.getAlignment())) {
            return base.getAlignment();
        }
        return DEFAULT_ALIGNMENT;
    }

    /**
     * A line margin of 0 means "use the style's margin", as in ASS event rows.
     * An explicit style margin of 0 is kept.
     */
    static int margin(Integer lineMargin, Integer styleMargin) {
        if (lineMargin != null && lineMargin != 0) {
            return lineMargin;
        }
        if (styleMargin != null) {
            return styleMargin;
        }
        return DEFAULT_MARGIN;
    }

    private static TextAlign textAlign(HorizontalAnchor horizontal) {
        switch (horizontal) {
            case LEFT:
                return TextAlign.LEFT;
            case RIGHT:
                return TextAlign.RIGHT;
            default:
                return TextAlign.CENTER;
        }
    }

    private static boolean isSet(Integer value) {
        return value != null && value != 0;
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0;
    }
}
