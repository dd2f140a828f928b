package com.assoverlay.subtitles;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number reading for script fields. Only the leading numeric part of a field is
 * read ("20.5" reads as integer 20, "12px" as 12); a field with no leading number is absent.
 */
public final class AssNumbers {

    private static final Pattern LEADING_INT = Pattern.compile("^[+-]?\\d+");
    private static final Pattern LEADING_DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private AssNumbers() {
    }

    public static Integer parseInteger(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = LEADING_INT.matcher(value.trim());
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.parseInt(m.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double parseDecimal(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = LEADING_DECIMAL.matcher(value.trim());
        if (!m.find()) {
            return null;
        }
        try {
            return Double.parseDouble(m.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
