package com.assoverlay.subtitles;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts ASS timestamps ({@code H:MM:SS.CC}) to milliseconds.
 */
public final class TimeCodec {

    private static final Pattern TIMESTAMP = Pattern.compile("^(\\d+):(\\d{2}):(\\d{2})\\.(\\d{2})$");

    private TimeCodec() {
    }

    /**
     * Decodes a timestamp into milliseconds. Anything that is not exactly
     * {@code H:MM:SS.CC} decodes to 0, the start of the timeline.
     */
    public static long decode(String text) {
        if (text == null) {
            return 0;
        }
        Matcher m = TIMESTAMP.matcher(text);
        if (!m.matches()) {
            return 0;
        }
        try {
            long hours = Long.parseLong(m.group(1));
            int minutes = Integer.parseInt(m.group(2));
            int seconds = Integer.parseInt(m.group(3));
            int centiseconds = Integer.parseInt(m.group(4));
            long hourMillis = Math.multiplyExact(hours, 3_600_000L);
            return Math.addExact(hourMillis, minutes * 60_000L + seconds * 1_000L + centiseconds * 10L);
        } catch (NumberFormatException | ArithmeticException e) {
            // hour count too large for a millisecond long
            return 0;
        }
    }
}
