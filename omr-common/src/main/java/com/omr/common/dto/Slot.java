package com.omr.common.dto;

import lombok.Value;

/**
 * 气泡的逻辑地址：题号 + 选项。
 */
@Value
public class Slot {

    int questionNumber;

    AnswerOption option;

    public static Slot of(int questionNumber, AnswerOption option) {
        return new Slot(questionNumber, option);
    }
}
