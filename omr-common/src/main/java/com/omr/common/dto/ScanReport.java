package com.omr.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

/**
 * 一次完整扫描的结果，序列化字段名与下游展示层约定一致。
 */
@Value
@Builder
public class ScanReport {

    /** 扫描流水号，用于日志追踪 */
    String scanId;

    /** 二维码内容（通常为学生编码），读取失败时为 null */
    @JsonProperty("qRCodeData")
    String qrCodeData;

    SizeClass sizeClass;

    /** 实际检测到的本版式定位标记数 */
    int observedMarkerCount;

    @JsonUnwrapped
    DecodeResult result;

    /** 处理耗时（毫秒） */
    long processingTimeMs;
}
