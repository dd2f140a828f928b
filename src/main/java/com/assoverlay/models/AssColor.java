package com.assoverlay.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * An RGBA color decoded from the ASS {@code &HAABBGGRR} notation.
 * Alpha is stored the CSS way: 1.00 is opaque, 0.00 is fully transparent.
 */
public final class AssColor {

    public static final AssColor WHITE = new AssColor(255, 255, 255, 1.0);
    public static final AssColor SHADOW_DEFAULT = new AssColor(0, 0, 0, 0.8);

    private final int red;
    private final int green;
    private final int blue;
    private final double alpha;

    public AssColor(int red, int green, int blue, double alpha) {
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.alpha = alpha;
    }

    public int getRed() { return red; }
    public int getGreen() { return green; }
    public int getBlue() { return blue; }
    public double getAlpha() { return alpha; }

    @JsonProperty("css")
    public String toCss() {
        return String.format(Locale.ROOT, "rgba(%d, %d, %d, %.2f)", red, green, blue, alpha);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssColor)) return false;
        AssColor other = (AssColor) o;
        return red == other.red && green == other.green && blue == other.blue
            && Double.compare(alpha, other.alpha) == 0;
    }

    @Override
    public int hashCode() {
        int result = red;
        result = 31 * result + green;
        result = 31 * result + blue;
        result = 31 * result + Double.hashCode(alpha);
        return result;
    }

    @Override
    public String toString() {
        return toCss();
    }
}
