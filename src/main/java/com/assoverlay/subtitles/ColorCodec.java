package com.assoverlay.subtitles;

import com.assoverlay.models.AssColor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes ASS colors. The hex digits after {@code &H} are alpha, blue, green, red,
 * in that order, and an alpha byte of 00 is opaque.
 */
public final class ColorCodec {

    private static final String PREFIX = "&H";
    private static final Pattern ABGR = Pattern.compile(
        "&H([0-9A-Fa-f]{2})([0-9A-Fa-f]{2})([0-9A-Fa-f]{2})([0-9A-Fa-f]{2})");

    private ColorCodec() {
    }

    /**
     * Decodes {@code &HAABBGGRR}. Returns {@link AssColor#WHITE} for anything undecodable.
     */
    public static AssColor decode(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            return AssColor.WHITE;
        }
        Matcher m = ABGR.matcher(text);
        if (!m.find()) {
            return AssColor.WHITE;
        }
        int alphaByte = Integer.parseInt(m.group(1), 16);
        int blue = Integer.parseInt(m.group(2), 16);
        int green = Integer.parseInt(m.group(3), 16);
        int red = Integer.parseInt(m.group(4), 16);
        double alpha = Math.round((1 - alphaByte / 255.0) * 100) / 100.0;
        return new AssColor(red, green, blue, alpha);
    }
}
