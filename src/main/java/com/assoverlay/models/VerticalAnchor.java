package com.assoverlay.models;

/**
 * Row of the numpad alignment grid: 7-9 top, 4-6 middle, 1-3 bottom.
 */
public enum VerticalAnchor {
    TOP,
    MIDDLE,
    BOTTOM;

    public static VerticalAnchor fromAlignment(int alignment) {
        if (alignment >= 7) {
            return TOP;
        }
        if (alignment >= 4) {
            return MIDDLE;
        }
        return BOTTOM;
    }
}
