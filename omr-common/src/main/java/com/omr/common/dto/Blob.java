package com.omr.common.dto;

import lombok.Value;

/**
 * 圆形检测器给出的候选气泡：圆心（列内局部坐标）和半径。
 */
@Value
public class Blob {

    double x;

    double y;

    double r;

    public static Blob of(double x, double y, double r) {
        return new Blob(x, y, r);
    }
}
