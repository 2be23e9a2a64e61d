package com.omr.common.dto;

/**
 * 选项字母及其数字编码（A=1 … D=4）。
 */
public enum AnswerOption {
    A(1),
    B(2),
    C(3),
    D(4);

    private final int numeric;

    AnswerOption(int numeric) {
        this.numeric = numeric;
    }

    public int numeric() {
        return numeric;
    }

    public static AnswerOption fromNumeric(int numeric) {
        for (AnswerOption option : values()) {
            if (option.numeric == numeric) {
                return option;
            }
        }
        throw new IllegalArgumentException("选项编码必须在 1~4 之间: " + numeric);
    }

    /**
     * 行内第 index 个气泡（从 0 开始，自左向右）对应的选项。
     */
    public static AnswerOption ofIndex(int index) {
        return values()[index];
    }
}
