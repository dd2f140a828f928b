package com.assoverlay.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Where a resolved line sits on the video surface.
 * <p>
 * Edge-relative positions carry one vertical and one horizontal anchor. TOP/BOTTOM and
 * LEFT/RIGHT use the matching edge offset; MIDDLE and CENTER sit at 50% of the surface and
 * rely on {@code offsetY}/{@code offsetX} to compensate. Absolute positions carry only
 * {@code left} and {@code top}, measured from the top-left corner.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Position {

    private final boolean absolute;
    private final VerticalAnchor vertical;
    private final HorizontalAnchor horizontal;
    private final Integer top;
    private final Integer bottom;
    private final Integer left;
    private final Integer right;
    private final double offsetX;
    private final double offsetY;

    private Position(boolean absolute, VerticalAnchor vertical, HorizontalAnchor horizontal,
                     Integer top, Integer bottom, Integer left, Integer right,
                     double offsetX, double offsetY) {
        this.absolute = absolute;
        this.vertical = vertical;
        this.horizontal = horizontal;
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
    }

    public static Position absolute(int x, int y) {
        return new Position(true, null, null, y, null, x, null, 0, 0);
    }

    /**
     * @param verticalMargin   distance from the anchored edge; ignored for MIDDLE
     * @param horizontalMargin distance from the anchored edge; ignored for CENTER
     */
    public static Position anchored(VerticalAnchor vertical, int verticalMargin,
                                    HorizontalAnchor horizontal, int horizontalMargin,
                                    double offsetX, double offsetY) {
        Integer top = vertical == VerticalAnchor.TOP ? Integer.valueOf(verticalMargin) : null;
        Integer bottom = vertical == VerticalAnchor.BOTTOM ? Integer.valueOf(verticalMargin) : null;
        Integer left = horizontal == HorizontalAnchor.LEFT ? Integer.valueOf(horizontalMargin) : null;
        Integer right = horizontal == HorizontalAnchor.RIGHT ? Integer.valueOf(horizontalMargin) : null;
        return new Position(false, vertical, horizontal, top, bottom, left, right, offsetX, offsetY);
    }

    public boolean isAbsolute() { return absolute; }
    public VerticalAnchor getVertical() { return vertical; }
    public HorizontalAnchor getHorizontal() { return horizontal; }
    public Integer getTop() { return top; }
    public Integer getBottom() { return bottom; }
    public Integer getLeft() { return left; }
    public Integer getRight() { return right; }
    public double getOffsetX() { return offsetX; }
    public double getOffsetY() { return offsetY; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return absolute == other.absolute
            && vertical == other.vertical
            && horizontal == other.horizontal
            && Objects.equals(top, other.top)
            && Objects.equals(bottom, other.bottom)
            && Objects.equals(left, other.left)
            && Objects.equals(right, other.right)
            && Double.compare(offsetX, other.offsetX) == 0
            && Double.compare(offsetY, other.offsetY) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(absolute, vertical, horizontal, top, bottom, left, right, offsetX, offsetY);
    }

    @Override
    public String toString() {
        return "Position{" +
            "absolute=" + absolute +
            ", vertical=" + vertical +
            ", horizontal=" + horizontal +
            ", top=" + top +
            ", bottom=" + bottom +
            ", left=" + left +
            ", right=" + right +
            ", offsetX=" + offsetX +
            ", offsetY=" + offsetY +
            '}';
    }
}
