package com.omr.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 答题区的一列：矫正后标准图中的矩形区域，以及该列容纳的题数。
 * <p>
 * 第 c 列（从 1 开始）负责题号 [(c-1)*Q+1, c*Q]。
 */
@Value
@Builder
public class ColumnRegion {

    /** 列序号，从 1 开始 */
    int index;

    /** 左上角 X（标准图像素） */
    int x;

    /** 左上角 Y（标准图像素） */
    int y;

    int width;

    int height;

    /** 每列题数 */
    int questionsPerColumn;

    /** 本列第一题之前的题号偏移 */
    public int questionBase() {
        return (index - 1) * questionsPerColumn;
    }

    public int firstQuestion() {
        return questionBase() + 1;
    }

    public int lastQuestion() {
        return index * questionsPerColumn;
    }

    public boolean overlaps(ColumnRegion other) {
        return x < other.x + other.width && other.x < x + width
                && y < other.y + other.height && other.y < y + height;
    }
}
