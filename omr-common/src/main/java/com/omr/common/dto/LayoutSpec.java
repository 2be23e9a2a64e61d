package com.omr.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 答题卡版式：由四个定位标记 ID 唯一确定，描述标准图尺寸、答题列区域和填涂阈值。
 */
@Value
@Builder
public class LayoutSpec {

    SizeClass sizeClass;

    /** 每个角对应的标记 ID */
    Map<CornerPosition, Integer> markerIdsByCorner;

    /** 按列序号排列的答题列 */
    @Singular
    List<ColumnRegion> columns;

    /** 标准图宽度（像素） */
    int canonicalWidth;

    /** 标准图高度（像素） */
    int canonicalHeight;

    /** 填涂判定灰度阈值，低于此值的采样点视为涂黑 */
    int fillThreshold;

    /** 气泡最小半径（标准图像素） */
    int blobMinRadius;

    /** 气泡最大半径（标准图像素） */
    int blobMaxRadius;

    public Set<Integer> markerIds() {
        return new TreeSet<>(markerIdsByCorner.values());
    }

    /**
     * 查找某个标记 ID 所在的角。
     */
    public Optional<CornerPosition> cornerOf(int markerId) {
        return markerIdsByCorner.entrySet().stream()
                .filter(e -> e.getValue() == markerId)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /** 宽高比 width / height */
    public double expectedRatio() {
        return (double) canonicalWidth / canonicalHeight;
    }

    public int totalPrintedQuestions() {
        return columns.stream().mapToInt(ColumnRegion::getQuestionsPerColumn).sum();
    }

    public static Map<CornerPosition, Integer> corners(int topLeft, int topRight, int bottomLeft, int bottomRight) {
        Map<CornerPosition, Integer> map = new EnumMap<>(CornerPosition.class);
        map.put(CornerPosition.TOP_LEFT, topLeft);
        map.put(CornerPosition.TOP_RIGHT, topRight);
        map.put(CornerPosition.BOTTOM_LEFT, bottomLeft);
        map.put(CornerPosition.BOTTOM_RIGHT, bottomRight);
        return map;
    }
}
