package com.assoverlay.models;

/**
 * Column of the numpad alignment grid: 1/4/7 left, 2/5/8 center, 3/6/9 right.
 */
public enum HorizontalAnchor {
    LEFT,
    CENTER,
    RIGHT;

    public static HorizontalAnchor fromAlignment(int alignment) {
        switch (alignment % 3) {
            case 1:
                return LEFT;
            case 0:
                return RIGHT;
            default:
                return CENTER;
        }
    }
}
