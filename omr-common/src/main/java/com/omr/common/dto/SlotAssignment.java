package com.omr.common.dto;

import lombok.Value;

/**
 * 网格解码结果：一个检测到的气泡及其被分配到的槽位。
 */
@Value
public class SlotAssignment {

    Slot slot;

    Blob blob;
}
