package com.omr.grading.service;

import com.omr.common.dto.LayoutSpec;
import com.omr.common.dto.Quad;
import lombok.Builder;
import lombok.Value;

/**
 * 单张答题卡的解码上下文，在各阶段之间显式传递，处理完即丢弃。
 */
@Value
@Builder
public class DecodeContext {

    String scanId;

    LayoutSpec layout;

    /** 原图中的纸张四角（可能部分由推算得到） */
    Quad quad;

    /** 实际观测到的本版式标记数 */
    int observedMarkers;

    public boolean isReconstructed() {
        return observedMarkers < 4;
    }
}
