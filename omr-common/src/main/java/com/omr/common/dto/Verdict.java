package com.omr.common.dto;

/**
 * 单题判定结果。
 */
public enum Verdict {
    CORRECT,
    WRONG,
    MULTIPLE,
    UNANSWERED
}
