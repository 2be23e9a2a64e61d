package com.omr.common.dto;

/**
 * 纸张四角的逻辑位置。
 */
public enum CornerPosition {
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_LEFT,
    BOTTOM_RIGHT
}
