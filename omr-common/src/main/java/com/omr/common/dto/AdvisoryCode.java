package com.omr.common.dto;

/**
 * 扫描质量提示类型（不影响出结果）。
 */
public enum AdvisoryCode {
    /** 某列识别到的行数明显少于应有题数 */
    LOW_ROW_DETECTION,
    /** 某行识别到的气泡少于 2 个 */
    SHORT_ROW,
    /** 相邻两行间距超过一个行距，中间有整行未识别 */
    MISSING_ROW,
    /** 某列未识别到任何气泡 */
    NO_BLOBS_IN_COLUMN,
    /** 部分定位标记缺失，四角由几何推算得到 */
    MARKERS_RECONSTRUCTED
}
