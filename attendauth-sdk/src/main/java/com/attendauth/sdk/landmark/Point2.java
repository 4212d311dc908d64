package com.attendauth.sdk.landmark;

/** 2-D 픽셀 좌표. */
public final class Point2 {
    public final double x;
    public final double y;

    public Point2(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double distanceTo(Point2 other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point2)) return false;
        Point2 p = (Point2) o;
        return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
    }

    @Override public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override public String toString() {
        return String.format("(%.1f, %.1f)", x, y);
    }
}
