package com.omr.common.util;

/**
 * 单通道灰度图的只读像素视图（0~255），坐标以左上角为原点。
 * <p>
 * 填涂判定只依赖这个接口，不直接依赖 OpenCV 的 Mat。
 */
public interface GrayscaleRaster {

    int width();

    int height();

    /**
     * 读取 (x, y) 处的灰度值。调用前需用 {@link #contains(int, int)} 确认坐标在图内。
     */
    int intensityAt(int x, int y);

    default boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width() && y < height();
    }
}
