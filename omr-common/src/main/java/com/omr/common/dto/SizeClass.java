package com.omr.common.dto;

/**
 * 答题卡纸张规格。
 */
public enum SizeClass {
    A4,
    A5
}
