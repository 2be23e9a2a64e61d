package com.omr.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 扫描质量提示，应展示给用户，但不会中断识别。
 */
@Value
@Builder
public class ScanAdvisory {

    AdvisoryCode code;

    /** 所在列，0 表示整张卡 */
    int column;

    /** 所在行（从 0 开始），-1 表示整列 */
    @Builder.Default
    int row = -1;

    String message;
}
