package com.omr.common.dto;

import lombok.Value;

/**
 * 像素坐标系中的点（x 向右，y 向下）。
 */
@Value
public class SheetPoint {

    double x;

    double y;

    public static SheetPoint of(double x, double y) {
        return new SheetPoint(x, y);
    }

    /**
     * 从原点出发，沿 angle 方向（弧度）走 length 得到的向量。
     */
    public static SheetPoint polar(double length, double angle) {
        return new SheetPoint(length * Math.cos(angle), length * Math.sin(angle));
    }

    public SheetPoint plus(SheetPoint other) {
        return new SheetPoint(x + other.x, y + other.y);
    }

    public SheetPoint minus(SheetPoint other) {
        return new SheetPoint(x - other.x, y - other.y);
    }

    public double distanceTo(SheetPoint other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    /**
     * 从本点指向 other 的方向角（弧度）。
     */
    public double angleTo(SheetPoint other) {
        return Math.atan2(other.y - y, other.x - x);
    }
}
