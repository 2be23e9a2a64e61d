package com.omr.grading.answer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omr.common.dto.AnswerOption;
import com.omr.common.exception.AnswerKeyMismatchException;

import java.util.ArrayList;
import java.util.List;

/**
 * 标准答案：按题号顺序排列的选项编码，取值 1~4（A~D）。
 * <p>
 * 长度即本次判分的总题数，可以少于答题卡印刷的题数。
 */
public final class AnswerKey {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<AnswerOption> options;

    private AnswerKey(List<AnswerOption> options) {
        this.options = List.copyOf(options);
    }

    public static AnswerKey of(List<Integer> numericAnswers) {
        if (numericAnswers == null || numericAnswers.isEmpty()) {
            throw new AnswerKeyMismatchException("标准答案不能为空");
        }
        List<AnswerOption> options = new ArrayList<>(numericAnswers.size());
        for (int i = 0; i < numericAnswers.size(); i++) {
            Integer value = numericAnswers.get(i);
            if (value == null || value < 1 || value > 4) {
                throw new AnswerKeyMismatchException("第 " + (i + 1) + " 题的标准答案必须在 1~4 之间，实际为 " + value);
            }
            options.add(AnswerOption.fromNumeric(value));
        }
        return new AnswerKey(options);
    }

    /**
     * 解析 JSON 数组形式的标准答案，如 "[1,3,2,4]"。
     */
    public static AnswerKey parse(String json) {
        List<Integer> values;
        try {
            values = MAPPER.readValue(json, new TypeReference<List<Integer>>() {
            });
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AnswerKeyMismatchException("标准答案格式不正确，应为数字数组", e);
        }
        return of(values);
    }

    /**
     * 校验题数与调用方预期一致。
     */
    public AnswerKey requireLength(int expected) {
        if (options.size() != expected) {
            throw new AnswerKeyMismatchException("标准答案题数为 " + options.size() + "，预期为 " + expected);
        }
        return this;
    }

    public int size() {
        return options.size();
    }

    /**
     * 第 questionNumber 题（从 1 开始）的正确选项。
     */
    public AnswerOption optionFor(int questionNumber) {
        return options.get(questionNumber - 1);
    }
}
