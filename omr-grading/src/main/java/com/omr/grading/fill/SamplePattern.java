package com.omr.grading.fill;

import java.util.List;

/**
 * 填涂判定的采样点布局：相对圆心的方向，乘以 半径 × 比例 得到像素偏移。
 */
public final class SamplePattern {

    private static final SamplePattern CROSS = new SamplePattern(0.5, List.of(
            new int[]{0, 0},
            new int[]{-1, 0},
            new int[]{1, 0},
            new int[]{0, -1},
            new int[]{0, 1}));

    private final double radiusFraction;
    private final List<int[]> directions;

    public SamplePattern(double radiusFraction, List<int[]> directions) {
        this.radiusFraction = radiusFraction;
        this.directions = List.copyOf(directions);
    }

    /**
     * 圆心 + 上下左右各半径一半处，共 5 点。
     */
    public static SamplePattern cross() {
        return CROSS;
    }

    /**
     * 给定半径下各采样点的整数像素偏移 (dx, dy)。半径先取整再按比例向下取整。
     */
    public int[][] offsets(double radius) {
        int step = (int) Math.floor(Math.round(radius) * radiusFraction);
        int[][] result = new int[directions.size()][];
        for (int i = 0; i < directions.size(); i++) {
            int[] d = directions.get(i);
            result[i] = new int[]{d[0] * step, d[1] * step};
        }
        return result;
    }

    public int size() {
        return directions.size();
    }
}
