package com.assoverlay.subtitles;

import com.assoverlay.models.FontStyle;
import com.assoverlay.models.FontWeight;
import com.assoverlay.models.OverrideSet;
import com.assoverlay.models.Point;
import com.assoverlay.models.TextDecoration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips inline {@code {\tag\tag...}} blocks from dialogue text and collects the overrides
 * they carry. Blocks do not nest. Unknown tags are dropped without error.
 */
public final class OverrideTagDecoder {

    private static final Pattern BLOCK = Pattern.compile("\\{\\\\([^}]*)\\}");
    private static final Pattern POS = Pattern.compile("pos\\((\\d+),(\\d+)\\)");
    private static final String COLOR_PREFIX = "&H";

    private OverrideTagDecoder() {
    }

    public static DecodedText decode(String text) {
        if (text == null || text.isEmpty()) {
            return new DecodedText(text == null ? "" : text, OverrideSet.EMPTY);
        }
        OverrideSet.Builder overrides = new OverrideSet.Builder();
        StringBuilder display = new StringBuilder(text.length());
        Matcher m = BLOCK.matcher(text);
        int last = 0;
        boolean sawBlock = false;
        while (m.find()) {
            sawBlock = true;
            display.append(text, last, m.start());
            for (String token : m.group(1).split("\\\\")) {
                if (!token.isEmpty()) {
                    applyTag(token, overrides);
                }
            }
            last = m.end();
        }
        if (!sawBlock) {
            return new DecodedText(text, OverrideSet.EMPTY);
        }
        display.append(text, last, text.length());
        return new DecodedText(display.toString(), overrides.build());
    }

    /**
     * Applies a single tag (without its leading backslash). The first matching rule wins.
     */
    static void applyTag(String token, OverrideSet.Builder overrides) {
        if (token.startsWith("fs")) {
            Integer size = AssNumbers.parseInteger(token.substring(2));
            if (size != null) {
                overrides.fontSize(size);
            }
        } else if ("b1".equals(token)) {
            overrides.fontWeight(FontWeight.BOLD);
        } else if ("b0".equals(token)) {
            overrides.fontWeight(FontWeight.NORMAL);
        } else if ("i1".equals(token)) {
            overrides.fontStyle(FontStyle.ITALIC);
        } else if ("i0".equals(token)) {
            overrides.fontStyle(FontStyle.NORMAL);
        } else if ("u1".equals(token)) {
            overrides.textDecoration(TextDecoration.UNDERLINE);
        } else if ("u0".equals(token)) {
            overrides.textDecoration(TextDecoration.NONE);
        } else if (token.startsWith("1c") || token.startsWith("c")) {
            int colorStart = token.indexOf(COLOR_PREFIX);
            if (colorStart >= 0) {
                overrides.color(ColorCodec.decode(token.substring(colorStart)));
            }
        } else if (token.startsWith("pos")) {
            Matcher pos = POS.matcher(token);
            if (pos.find()) {
                Integer x = AssNumbers.parseInteger(pos.group(1));
                Integer y = AssNumbers.parseInteger(pos.group(2));
                if (x != null && y != null) {
                    overrides.position(new Point(x, y));
                }
            }
        } else if (token.startsWith("an")) {
            Integer alignment = AssNumbers.parseInteger(token.substring(2));
            if (alignment != null) {
                overrides.alignment(alignment);
            }
        }
    }
}
