package com.omr.common.dto;

import lombok.Value;

/**
 * 单个已检测气泡的填涂状态。
 */
@Value
public class FillState {

    Slot slot;

    boolean filled;
}
