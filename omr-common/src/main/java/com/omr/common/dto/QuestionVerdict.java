package com.omr.common.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 单题汇总结果。
 */
@Value
@Builder
public class QuestionVerdict {

    /** 题号，从 1 开始 */
    int questionNumber;

    /** 被涂黑的选项 */
    Set<AnswerOption> selectedOptions;

    Verdict verdict;

    /** 唯一作答时的选项编码 1~4，否则为 0 */
    int chosenNumeric;
}
