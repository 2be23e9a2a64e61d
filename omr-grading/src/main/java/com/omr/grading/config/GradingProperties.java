package com.omr.grading.config;

import com.omr.common.dto.SizeClass;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 答题卡解码配置项。默认值对应现行印刷的 A4 / A5 两种答题卡。
 */
@Data
@ConfigurationProperties(prefix = "omr.grading")
public class GradingProperties {

    /** 分行容差（像素）：相邻气泡 Y 差超过此值即视为新的一行 */
    private double rowTolerance = 15;

    /** 识别行数低于每列题数的该比例时给出提示 */
    private double minRowDetectionRatio = 0.7;

    /** 单行气泡少于此数时给出提示 */
    private int minBlobsPerRow = 2;

    /** 各角取标记四个角点中的第几个（ArUco 顺序：0 左上、1 右上、2 右下、3 左下） */
    private MarkerCorners markerCorners = new MarkerCorners();

    /** 已知版式，标记 ID 不得重复 */
    private List<Layout> layouts = defaultLayouts();

    @Data
    public static class MarkerCorners {
        private int topLeft = 0;
        private int topRight = 3;
        private int bottomLeft = 1;
        private int bottomRight = 2;
    }

    @Data
    public static class Layout {

        private SizeClass sizeClass;

        private int topLeftId;
        private int topRightId;
        private int bottomLeftId;
        private int bottomRightId;

        /** 标准图尺寸 */
        private int canonicalWidth = 2360;
        private int canonicalHeight = 3388;

        /** 填涂判定灰度阈值 */
        private int fillThreshold = 120;

        /** 气泡半径范围 */
        private int blobMinRadius = 16;
        private int blobMaxRadius = 26;

        private int questionsPerColumn = 30;

        /** 各列区域，按列序排列 */
        private List<Column> columns = new ArrayList<>();
    }

    /**
     * 列区域，坐标为标准图中的左上角 (x1, y1) 与右下角 (x2, y2)。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Column {
        private int x1;
        private int y1;
        private int x2;
        private int y2;
    }

    private static List<Layout> defaultLayouts() {
        Layout a4 = new Layout();
        a4.setSizeClass(SizeClass.A4);
        a4.setTopLeftId(1);
        a4.setTopRightId(2);
        a4.setBottomLeftId(3);
        a4.setBottomRightId(4);
        a4.setFillThreshold(120);
        a4.setBlobMinRadius(16);
        a4.setBlobMaxRadius(26);
        a4.setQuestionsPerColumn(30);
        a4.setColumns(new ArrayList<>(List.of(
                new Column(200, 1180, 600, 3180),
                new Column(740, 1180, 1140, 3180),
                new Column(1313, 1180, 1713, 3180),
                new Column(1860, 1180, 2260, 3180))));

        Layout a5 = new Layout();
        a5.setSizeClass(SizeClass.A5);
        a5.setTopLeftId(5);
        a5.setTopRightId(6);
        a5.setBottomLeftId(7);
        a5.setBottomRightId(8);
        a5.setFillThreshold(60);
        a5.setBlobMinRadius(21);
        a5.setBlobMaxRadius(31);
        a5.setQuestionsPerColumn(20);
        a5.setColumns(new ArrayList<>(List.of(
                new Column(250, 1430, 750, 3190),
                new Column(950, 1430, 1480, 3190),
                new Column(1680, 1430, 2220, 3190))));

        return new ArrayList<>(List.of(a4, a5));
    }
}
