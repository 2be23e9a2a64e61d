package com.omr.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 完整的四边形，四个角点顺序固定为：左上、右上、左下、右下。
 */
@Value
@Builder
public class Quad {

    SheetPoint topLeft;

    SheetPoint topRight;

    SheetPoint bottomLeft;

    SheetPoint bottomRight;

    public SheetPoint get(CornerPosition position) {
        switch (position) {
            case TOP_LEFT:
                return topLeft;
            case TOP_RIGHT:
                return topRight;
            case BOTTOM_LEFT:
                return bottomLeft;
            case BOTTOM_RIGHT:
                return bottomRight;
            default:
                throw new IllegalArgumentException("未知角点位置: " + position);
        }
    }

    public List<SheetPoint> toList() {
        return List.of(topLeft, topRight, bottomLeft, bottomRight);
    }

    /**
     * 任意三个角点构成的三角形面积小于 minArea（平方像素），或四边形本身面积过小时，视为退化。
     */
    public boolean isDegenerate(double minArea) {
        List<SheetPoint> pts = toList();
        for (SheetPoint p : pts) {
            if (!Double.isFinite(p.getX()) || !Double.isFinite(p.getY())) {
                return true;
            }
        }
        for (int i = 0; i < 4; i++) {
            for (int j = i + 1; j < 4; j++) {
                for (int k = j + 1; k < 4; k++) {
                    if (triangleArea(pts.get(i), pts.get(j), pts.get(k)) < minArea) {
                        return true;
                    }
                }
            }
        }
        return area() < minArea;
    }

    /**
     * 按 左上 → 右上 → 右下 → 左下 的环绕顺序用鞋带公式计算面积。
     */
    public double area() {
        SheetPoint[] ring = {topLeft, topRight, bottomRight, bottomLeft};
        double sum = 0;
        for (int i = 0; i < ring.length; i++) {
            SheetPoint a = ring[i];
            SheetPoint b = ring[(i + 1) % ring.length];
            sum += a.getX() * b.getY() - b.getX() * a.getY();
        }
        return Math.abs(sum) / 2.0;
    }

    private static double triangleArea(SheetPoint a, SheetPoint b, SheetPoint c) {
        double cross = (b.getX() - a.getX()) * (c.getY() - a.getY())
                - (b.getY() - a.getY()) * (c.getX() - a.getX());
        return Math.abs(cross) / 2.0;
    }
}
