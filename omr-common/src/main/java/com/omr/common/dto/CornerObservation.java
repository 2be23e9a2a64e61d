package com.omr.common.dto;

import java.util.Objects;

/**
 * 单个角点的观测结果：已知（带坐标）或未知。
 */
public final class CornerObservation {

    private static final CornerObservation UNKNOWN = new CornerObservation(null);

    private final SheetPoint point;

    private CornerObservation(SheetPoint point) {
        this.point = point;
    }

    public static CornerObservation known(SheetPoint point) {
        return new CornerObservation(Objects.requireNonNull(point, "point"));
    }

    public static CornerObservation unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return point != null;
    }

    public SheetPoint point() {
        if (point == null) {
            throw new IllegalStateException("角点未观测到");
        }
        return point;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CornerObservation)) return false;
        return Objects.equals(point, ((CornerObservation) o).point);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(point);
    }

    @Override
    public String toString() {
        return point == null ? "Unknown" : "Known" + point;
    }
}
